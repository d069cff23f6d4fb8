package com.bifnet.api;

import com.bifnet.graph.BayesNetModels.ModelSummary;
import com.bifnet.parser.ParserDtos.BifNetwork;
import com.bifnet.parser.XmlBifSource;
import com.bifnet.service.NetworkCodecService;
import com.bifnet.writer.WriterDtos.NetworkDescription;
import com.bifnet.writer.WriterDtos.WriterOptions;
import com.bifnet.writer.XmlBifDocument;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.Charset;

@RestController
@RequestMapping("/api/xmlbif")
public class XmlBifController {
    private final NetworkCodecService codecService;

    public XmlBifController(NetworkCodecService codecService) {
        this.codecService = codecService;
    }

    @PostMapping(value = "/read", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<BifNetwork> read(@RequestBody String xml) {
        return ResponseEntity.ok(codecService.read(XmlBifSource.fromString(xml)));
    }

    @PostMapping(value = "/model", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ModelSummary> model(@RequestBody String xml) {
        return ResponseEntity.ok(codecService.summarize(codecService.readModel(XmlBifSource.fromString(xml))));
    }

    @PostMapping(value = "/write", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> write(@RequestBody NetworkDescription description,
                                        @RequestParam(required = false) Boolean prettyPrint,
                                        @RequestParam(required = false) String encoding) {
        XmlBifDocument document;
        if (prettyPrint == null && encoding == null) {
            document = codecService.write(description);
        } else {
            WriterOptions defaults = codecService.defaultOptions();
            document = codecService.write(description, new WriterOptions(
                    encoding == null ? defaults.encoding() : Charset.forName(encoding),
                    prettyPrint == null ? defaults.prettyPrint() : prettyPrint));
        }
        MediaType type = new MediaType(MediaType.APPLICATION_XML, document.options().encoding());
        return ResponseEntity.ok().contentType(type).body(document.toBytes());
    }
}
