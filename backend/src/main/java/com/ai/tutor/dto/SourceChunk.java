package com.ai.tutor.dto;

import lombok.Value;

/**
 * A chunk ready to be embedded and stored.
 */
@Value
public class SourceChunk {

    String text;
    int chunkIndex;
    String locator;
}
