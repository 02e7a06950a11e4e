package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckOutcome {
    private String status;              // "present", "missing", "passed", "failed" or "warning"
    private String message;
    private String value;

    public static CheckOutcome failed(String message) {
        return CheckOutcome.builder().status("failed").message(message).build();
    }

    public static CheckOutcome warning(String message) {
        return CheckOutcome.builder().status("warning").message(message).build();
    }
}
