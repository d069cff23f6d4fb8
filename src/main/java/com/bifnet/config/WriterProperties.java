package com.bifnet.config;

import com.bifnet.writer.WriterDtos.WriterOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Defaults applied when a document is written without explicit options
 * (prefix {@code xmlbif.writer.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "xmlbif.writer")
public class WriterProperties {

    /**
     * Charset of the serialized document.
     */
    private Charset encoding = StandardCharsets.UTF_8;

    /**
     * Indent nested elements two spaces per level.
     */
    private boolean prettyPrint = true;

    public WriterOptions toOptions() {
        return new WriterOptions(encoding, prettyPrint);
    }
}
