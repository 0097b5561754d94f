package com.edutrack.backend.dto;

import com.edutrack.backend.domain.enums.InvoiceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public class FinanceDTOs {

    public record CreateInvoiceRequest(
        @JsonProperty("student_id") @NotNull String studentId,
        @NotNull Double amount,
        String currency,
        @JsonProperty("due_date") LocalDate dueDate,
        InvoiceStatus status,
        String memo
    ) {
        public CreateInvoiceRequest {
            if (currency == null || currency.isBlank()) currency = "USD";
            if (status == null) status = InvoiceStatus.OPEN;
        }
    }

    public record CreatePaymentRequest(
        @JsonProperty("invoice_id") @NotNull String invoiceId,
        @NotNull Double amount,
        String method,
        String reference
    ) {
        public CreatePaymentRequest {
            if (method == null || method.isBlank()) method = "cash";
        }
    }
}
