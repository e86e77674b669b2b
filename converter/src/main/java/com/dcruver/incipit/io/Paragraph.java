package com.dcruver.incipit.io;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A paragraph: optional style name and its inline content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Paragraph {
    private String style;

    @Builder.Default
    private List<Inline> inlines = new ArrayList<>();

    public static Paragraph of(Inline... inlines) {
        return Paragraph.builder().inlines(new ArrayList<>(List.of(inlines))).build();
    }

    /**
     * Concatenated text of the paragraph's text runs
     */
    @JsonIgnore
    public String getPlainText() {
        StringBuilder sb = new StringBuilder();
        for (Inline inline : inlines) {
            if (inline.getKind() == InlineKind.TEXT && inline.getText() != null) {
                sb.append(inline.getText());
            }
        }
        return sb.toString();
    }
}
