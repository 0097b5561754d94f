package com.edutrack.backend.controller;

import com.edutrack.backend.config.EduTrackProperties;
import com.edutrack.backend.core.tenant.TenantContext;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.FinanceDTOs.CreateInvoiceRequest;
import com.edutrack.backend.dto.FinanceDTOs.CreatePaymentRequest;
import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.service.PaymentService;
import com.edutrack.backend.service.TenantDocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Fee invoices and the payments made against them.
 */
@RestController
@RequiredArgsConstructor
public class FinanceController {

    private final TenantDocumentService documentService;
    private final PaymentService paymentService;
    private final EduTrackProperties properties;

    @GetMapping("/invoices")
    public List<Map<String, Object>> listInvoices(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.defaultListLimit();
        return documentService.list(SchoolCollection.INVOICE, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    @PostMapping("/invoices")
    public CreatedResponse createInvoice(@Valid @RequestBody CreateInvoiceRequest request) {
        String id = documentService.create(SchoolCollection.INVOICE, TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, "Invoice created");
    }

    @GetMapping("/payments")
    public List<Map<String, Object>> listPayments(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.defaultListLimit();
        return documentService.list(SchoolCollection.PAYMENT, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    // Succeeds even when the invoice cannot be marked as paid
    @PostMapping("/payments")
    public CreatedResponse recordPayment(@Valid @RequestBody CreatePaymentRequest request) {
        String id = paymentService.recordPayment(TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, "Payment created");
    }
}
