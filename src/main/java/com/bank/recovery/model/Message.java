package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {
    private String messageId;
    private MessageRole role;
    private String content;
    private Double confidence;          // assistant messages only
    @Builder.Default
    private List<String> complianceTags = new ArrayList<>();
    private long createdAt;
}
