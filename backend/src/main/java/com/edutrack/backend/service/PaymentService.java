package com.edutrack.backend.service;

import com.edutrack.backend.core.id.IdentifierCodec;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.domain.enums.InvoiceStatus;
import com.edutrack.backend.dto.FinanceDTOs.CreatePaymentRequest;
import com.edutrack.backend.store.DocumentStore;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final TenantDocumentService documentService;
    private final DocumentStore documentStore;
    private final IdentifierCodec identifierCodec;

    /**
     * Records the payment, then marks the referenced invoice as paid. The two writes are
     * independent: the payment stays recorded whatever happens to the invoice update.
     */
    public String recordPayment(String tenantId, CreatePaymentRequest request) {
        String paymentId = documentService.create(SchoolCollection.PAYMENT, tenantId, request);
        markInvoicePaidBestEffort(request.invoiceId());
        return paymentId;
    }

    /**
     * Best-effort: sets the invoice status to paid, looked up by id alone. The amount is not
     * compared with the invoice total. Failures are logged and dropped, never thrown.
     */
    void markInvoicePaidBestEffort(String invoiceId) {
        try {
            ObjectId objectId = identifierCodec.decode(invoiceId);
            long matched = documentStore.updateOne(
                    SchoolCollection.INVOICE.collectionName(),
                    Map.of(DocumentStore.ID_FIELD, objectId),
                    Map.of("status", InvoiceStatus.PAID.value()));
            if (matched == 0) {
                log.warn("Payment references unknown invoice {}; invoice left unchanged", invoiceId);
            }
        } catch (RuntimeException e) {
            log.warn("Could not mark invoice {} as paid: {}", invoiceId, e.getMessage());
        }
    }
}
