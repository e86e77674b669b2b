package com.dcruver.incipit.io;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An endnote with its id and its paragraphs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Endnote {
    private String id;

    @Builder.Default
    private List<Paragraph> paragraphs = new ArrayList<>();

    /**
     * Raw note text: all text runs of all paragraphs, without the note's own number mark
     */
    @JsonIgnore
    public String getRawText() {
        StringBuilder sb = new StringBuilder();
        for (Paragraph paragraph : paragraphs) {
            sb.append(paragraph.getPlainText());
        }
        return sb.toString();
    }
}
