package com.ai.tutor.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text of one page (or transcript segment) of a source, already extracted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourcePage {

    /** Page number or timestamp; copied onto every chunk cut from this page. */
    @Size(max = 64)
    private String locator;

    @NotNull
    private String text;
}
