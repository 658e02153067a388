package com.example.baselinediff.dto.response;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifier counts of one classification run.
 * Serialized from fields so the keys read {@code aOnly} and {@code bOnly}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationSummary {

    @JsonProperty("totalA")
    private int totalA;

    @JsonProperty("totalB")
    private int totalB;

    private int shared;

    @JsonProperty("aOnly")
    private int aOnly;

    @JsonProperty("bOnly")
    private int bOnly;
}
