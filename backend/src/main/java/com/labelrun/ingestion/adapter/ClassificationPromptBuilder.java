package com.labelrun.ingestion.adapter;

import com.labelrun.domain.Label;
import com.labelrun.domain.SourceRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the fixed system instruction (closed label set + answer structure) and the indexed user message.
 */
@Component
public class ClassificationPromptBuilder {

    private static final String LABEL_HINTS = """
            You are an expert at identifying religious backgrounds of voters in Kerala, India based on names.

            Hindu indicators: names of deities (Krishna, Vishnu, Lakshmi, Devi), Sanskrit-origin names, names ending \
            in -an/-kuttan (male) or -kumari/-devi (female), house names with Bhavanam/Mandiram/Illam.

            Christian indicators: Biblical or Western names (George, Jose, Mary, Thomas), names of saints, house names \
            with Villa/Nivas/Dale/Bhavan, guardian names like Xavier/Sebastian/Francis.

            Muslim indicators: Arabic names (Mohammed, Abdul, Ayesha, Fathima), Islamic naming patterns, house names \
            with Manzil/Padi/Purayidam.
            """;

    private final String systemPrompt;

    public ClassificationPromptBuilder() {
        String allowed = Label.whitelist().stream().map(Label::wireName).collect(Collectors.joining(", "));
        String example = Label.whitelist().stream().limit(2)
                .map(l -> "{\"" + PredictionParser.INDEX + "\": " + l.ordinal() + ", \"" + PredictionParser.LABEL
                        + "\": \"" + l.wireName() + "\"}")
                .collect(Collectors.joining(", "));
        this.systemPrompt = LABEL_HINTS
                + "\nIMPORTANT: You MUST classify each entry as EXACTLY one of: " + allowed + ". No other values allowed.\n"
                + "\nReturn JSON with this exact structure:\n"
                + "{\"" + PredictionParser.PREDICTIONS + "\": [" + example + ", ...]}\n"
                + "\nReturn one prediction per entry, using the entry's number as its index.";
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    /**
     * One line per record, numbered by its position in the batch: "0. Name: X, Guardian: Y, House: Z".
     */
    public String userPrompt(List<SourceRecord> batch) {
        StringBuilder sb = new StringBuilder("Classify these entries:\n\n");
        for (int i = 0; i < batch.size(); i++) {
            sb.append(i).append(". ").append(describe(batch.get(i).fields())).append('\n');
        }
        return sb.toString();
    }

    private static String describe(Map<String, String> fields) {
        return fields.entrySet().stream()
                .map(e -> e.getKey() + ": " + (e.getValue() == null ? "" : e.getValue().strip()))
                .collect(Collectors.joining(", "));
    }
}
