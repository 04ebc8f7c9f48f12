package com.example.musiccurator.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.match")
public class AppMatchProperties {

    /**
     * Suffixes removed (case-insensitive) from titles before fuzzy comparison.
     */
    private List<String> noiseTokens = new ArrayList<>(Arrays.asList(
            "(original mix)", "(radio edit)", "(album version)", "(extended mix)", "(extended)",
            "(remastered)", "- remastered", "[official]", "[official video]", "[hd]",
            "(explicit)", "(clean)"));
}
