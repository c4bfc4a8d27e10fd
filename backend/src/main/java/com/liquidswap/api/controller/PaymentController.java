package com.liquidswap.api.controller;

import com.liquidswap.sdk.LiquidSdk;
import com.liquidswap.sdk.model.Payment;
import com.liquidswap.sdk.model.PrepareReceiveRequest;
import com.liquidswap.sdk.model.PrepareReceiveResponse;
import com.liquidswap.sdk.model.PrepareSendRequest;
import com.liquidswap.sdk.model.PrepareSendResponse;
import com.liquidswap.sdk.model.ReceivePaymentResponse;
import com.liquidswap.sdk.model.SendPaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Two-step receive and send: prepare returns a fee quote, the second call executes it unchanged.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final LiquidSdk sdk;

    @PostMapping("/prepare-receive")
    public ResponseEntity<PrepareReceiveResponse> prepareReceive(@Valid @RequestBody PrepareReceiveRequest request) {
        return ResponseEntity.ok(sdk.prepareReceivePayment(request));
    }

    @PostMapping("/receive")
    public ResponseEntity<ReceivePaymentResponse> receive(@Valid @RequestBody PrepareReceiveResponse request) {
        return ResponseEntity.ok(sdk.receivePayment(request));
    }

    @PostMapping("/prepare-send")
    public ResponseEntity<PrepareSendResponse> prepareSend(@Valid @RequestBody PrepareSendRequest request) {
        return ResponseEntity.ok(sdk.prepareSendPayment(request));
    }

    @PostMapping("/send")
    public ResponseEntity<SendPaymentResponse> send(@Valid @RequestBody PrepareSendResponse request) {
        return ResponseEntity.ok(sdk.sendPayment(request));
    }

    @GetMapping
    public ResponseEntity<List<Payment>> list() {
        return ResponseEntity.ok(sdk.listPayments());
    }
}
