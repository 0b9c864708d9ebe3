package decentralabs.settlement.controller.intent;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import decentralabs.settlement.dto.intent.CreateIntentRequest;
import decentralabs.settlement.dto.intent.IntentAckResponse;
import decentralabs.settlement.dto.intent.IntentResponse;
import decentralabs.settlement.dto.intent.ReceiptResponse;
import decentralabs.settlement.dto.intent.SourceProofRequest;
import decentralabs.settlement.exception.InvalidInputException;
import decentralabs.settlement.service.intent.PaymentIntent;
import decentralabs.settlement.service.intent.PaymentIntentService;
import decentralabs.settlement.util.LogSanitizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("${endpoint.intents:/intents}")
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentController {

    private final PaymentIntentService paymentIntentService;

    @PostMapping
    public ResponseEntity<IntentResponse> createIntent(@RequestBody @Valid CreateIntentRequest request) {
        PaymentIntent intent = paymentIntentService.createIntent(request.getAmount(), request.getMerchantRecipient());
        return ResponseEntity.status(HttpStatus.CREATED).body(IntentResponse.from(intent));
    }

    @GetMapping
    public ResponseEntity<IntentResponse> findIntent(@RequestParam(name = "intent_id", required = false) String intentId) {
        if (intentId == null || intentId.isBlank()) {
            throw new InvalidInputException("intent_id is required");
        }
        return getIntent(intentId);
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<IntentResponse> getIntent(@PathVariable String intentId) {
        return ResponseEntity.ok(IntentResponse.from(paymentIntentService.getIntent(intentId)));
    }

    @PostMapping("/{intentId}/source-proof")
    public ResponseEntity<IntentAckResponse> submitSourceProof(
        @PathVariable String intentId,
        @RequestBody @Valid SourceProofRequest request
    ) {
        PaymentIntent intent = paymentIntentService.submitSourceProof(
            intentId, request.getSettleProof(), request.getTxHash(), request.getPayerWallet());
        return ResponseEntity.ok(IntentAckResponse.builder()
            .success(true)
            .message("Source settlement verified; target settlement dispatched")
            .intentId(intent.getIntentId())
            .status(intent.getStatus())
            .build());
    }

    @PostMapping("/{intentId}/trigger-target-payment")
    public ResponseEntity<IntentAckResponse> triggerTargetPayment(@PathVariable String intentId) {
        PaymentIntent intent = paymentIntentService.triggerTargetPayment(intentId);
        return ResponseEntity.ok(IntentAckResponse.builder()
            .success(true)
            .message("Target settlement completed")
            .intentId(intent.getIntentId())
            .status(intent.getStatus())
            .targetTxRef(intent.getTargetTxRef())
            .build());
    }

    @GetMapping("/{intentId}/receipt")
    public ResponseEntity<ReceiptResponse> getReceipt(@PathVariable String intentId) {
        return ResponseEntity.ok(paymentIntentService.getReceipt(intentId));
    }

    /**
     * Operator entry point, restricted to localhost by {@code LocalhostOnlyFilter}.
     */
    @PostMapping("/{intentId}/reconcile")
    public ResponseEntity<IntentResponse> reconcile(
        @PathVariable String intentId,
        @RequestParam(name = "force_rollback", defaultValue = "false") boolean forceRollback
    ) {
        log.info("Operator reconcile of intent {} (force_rollback={})", LogSanitizer.sanitize(intentId), forceRollback);
        return ResponseEntity.ok(IntentResponse.from(paymentIntentService.reconcile(intentId, forceRollback)));
    }
}
