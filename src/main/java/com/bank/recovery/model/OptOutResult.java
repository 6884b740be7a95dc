package com.bank.recovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptOutResult {
    private String debtorId;
    private long optOutAt;
    private int conversationsUpdated;
    private String message;
}
