package com.bifnet.service;

import com.bifnet.config.WriterProperties;
import com.bifnet.graph.BayesNetModels.CpdSummary;
import com.bifnet.graph.BayesNetModels.ModelSummary;
import com.bifnet.graph.BayesianNetwork;
import com.bifnet.graph.TabularCpd;
import com.bifnet.parser.ParserDtos.BifNetwork;
import com.bifnet.parser.XmlBifReader;
import com.bifnet.parser.XmlBifSource;
import com.bifnet.writer.WriterDtos.NetworkDescription;
import com.bifnet.writer.WriterDtos.WriterOptions;
import com.bifnet.writer.XmlBifDocument;
import com.bifnet.writer.XmlBifWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
public class NetworkCodecService {
    private final XmlBifReader reader;
    private final XmlBifWriter writer;
    private final WriterProperties writerProperties;

    public NetworkCodecService(XmlBifReader reader, XmlBifWriter writer, WriterProperties writerProperties) {
        this.reader = reader;
        this.writer = writer;
        this.writerProperties = writerProperties;
    }

    public BifNetwork read(XmlBifSource source) {
        return reader.read(source);
    }

    public BayesianNetwork readModel(XmlBifSource source) {
        return buildModel(reader.read(source));
    }

    /**
     * Projects the intermediate model onto a {@link BayesianNetwork}: every declared variable becomes a
     * node, every parent link an edge, and every TABLE a {@link TabularCpd} whose values are the
     * row-major flattening of the table.
     */
    public BayesianNetwork buildModel(BifNetwork network) {
        BayesianNetwork model = new BayesianNetwork(network.variables(), network.edges());

        List<TabularCpd> tables = network.cpds().entrySet().stream()
                .map(e -> {
                    List<String> evidence = network.parentsOf(e.getKey());
                    return new TabularCpd(e.getKey(),
                            network.cardinality(e.getKey()),
                            e.getValue().flatten(),
                            evidence,
                            evidence.stream().map(network::cardinality).toList());
                })
                .toList();

        model.addCpds(tables.toArray(TabularCpd[]::new));
        log.debug("Built model with {} nodes, {} edges, {} CPDs", model.nodes().size(), model.edges().size(), tables.size());
        return model;
    }

    public ModelSummary summarize(BayesianNetwork model) {
        List<CpdSummary> cpds = model.cpds().stream()
                .map(c -> new CpdSummary(c.variable(), c.cardinality(), c.evidence(), c.evidenceCardinality(), rows(c)))
                .toList();
        return new ModelSummary(model.nodes(), model.edges(), cpds, model.checkModel());
    }

    private static List<List<Double>> rows(TabularCpd cpd) {
        return Arrays.stream(cpd.toMatrix())
                .map(row -> Arrays.stream(row).boxed().toList())
                .toList();
    }

    public WriterOptions defaultOptions() {
        return writerProperties.toOptions();
    }

    public XmlBifDocument write(NetworkDescription description) {
        return write(description, defaultOptions());
    }

    public XmlBifDocument write(NetworkDescription description, WriterOptions options) {
        return writer.write(description, options);
    }

    /**
     * Writer input carrying everything a read produced, so a document can be written back.
     */
    public NetworkDescription toDescription(BifNetwork network) {
        return new NetworkDescription(network.networkName(), network.variables(), network.states(),
                network.parents(), network.properties(), network.cpds());
    }
}
