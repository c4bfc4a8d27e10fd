package com.liquidswap.api.controller;

import com.liquidswap.api.dto.CheckMessageRequest;
import com.liquidswap.api.dto.CheckMessageResponse;
import com.liquidswap.api.dto.SignMessageRequest;
import com.liquidswap.api.dto.SignMessageResponse;
import com.liquidswap.api.dto.SyncResponse;
import com.liquidswap.recovery.RecoveryReport;
import com.liquidswap.sdk.LiquidSdk;
import com.liquidswap.sdk.model.GetInfoRequest;
import com.liquidswap.sdk.model.GetInfoResponse;
import com.liquidswap.sdk.model.RestoreRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Wallet-level bridge calls: info, sync, backup/restore, cache reset, message signing.
 */
@RestController
@RequestMapping("/api/v1/wallet")
@RequiredArgsConstructor
public class WalletController {

    private final LiquidSdk sdk;

    @GetMapping("/info")
    public ResponseEntity<GetInfoResponse> info(@RequestParam(name = "withScan", defaultValue = "false") boolean withScan) {
        return ResponseEntity.ok(sdk.getInfo(new GetInfoRequest(withScan)));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> sync() {
        RecoveryReport report = sdk.sync();
        return ResponseEntity.ok(new SyncResponse(report.scanned(), report.updated(), report.failed()));
    }

    @PostMapping("/backup")
    public ResponseEntity<Void> backup() {
        sdk.backup();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/restore")
    public ResponseEntity<Void> restore(@RequestBody(required = false) RestoreRequest request) {
        sdk.restore(request != null ? request : new RestoreRequest(null));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/empty-cache")
    public ResponseEntity<Void> emptyCache() {
        sdk.emptyWalletCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sign-message")
    public ResponseEntity<SignMessageResponse> signMessage(@Valid @RequestBody SignMessageRequest request) {
        return ResponseEntity.ok(new SignMessageResponse(sdk.signMessage(request.message())));
    }

    @PostMapping("/check-message")
    public ResponseEntity<CheckMessageResponse> checkMessage(@Valid @RequestBody CheckMessageRequest request) {
        boolean valid = sdk.checkMessage(request.message(), request.pubkey(), request.signature());
        return ResponseEntity.ok(new CheckMessageResponse(valid));
    }
}
