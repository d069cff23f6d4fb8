package com.bifnet.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the XMLBIF reader (prefix {@code xmlbif.reader.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "xmlbif.reader")
public class ReaderProperties {

    /**
     * Refuse DOCTYPE declarations and external entities while parsing.
     */
    private boolean secureProcessing = true;
}
