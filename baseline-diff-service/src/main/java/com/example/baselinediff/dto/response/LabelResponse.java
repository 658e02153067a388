package com.example.baselinediff.dto.response;

import com.example.baselinediff.entity.Label;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelResponse {

    private Long id;
    private String name;

    @JsonProperty("isDefault")
    private boolean defaultLabel;

    public static LabelResponse from(Label label) {
        return LabelResponse.builder()
                .id(label.getId())
                .name(label.getName())
                .defaultLabel(label.isDefaultLabel())
                .build();
    }
}
