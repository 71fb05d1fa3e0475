package com.labelrun.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File campaign config: where source tables live, where annotated copies go, and which columns feed the prompt.
 */
@ConfigurationProperties(prefix = "labelrun.campaign")
@NoArgsConstructor
@Getter
@Setter
public class CampaignProperties {

    /** Run the campaign once the application is ready. */
    private boolean enabled = false;

    private String inputDirectory = "input";

    private String outputDirectory = "output";

    /** Output column holding the label; appended when the source table lacks it. */
    private String labelColumn = "religion";

    /** Prompt field name -> source column header, in prompt order. */
    private Map<String, String> promptColumns = defaultPromptColumns();

    /** Expected record count across all files; used for ETA only. 0 disables the ETA line. */
    private long expectedTotalRecords = 0;

    private static Map<String, String> defaultPromptColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("Name", "Name");
        columns.put("Guardian", "Guardian's Name");
        columns.put("House", "House Name");
        return columns;
    }
}
