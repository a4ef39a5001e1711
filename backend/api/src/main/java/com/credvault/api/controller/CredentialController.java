package com.credvault.api.controller;

import com.credvault.api.dto.CreateCredentialResponse;
import com.credvault.api.dto.Credential;
import com.credvault.api.dto.CredentialOut;
import com.credvault.api.service.CredentialService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Create and search credential records. Store failures are turned into
 * {@code 500 {"detail": ...}} by the global exception handler.
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
@Slf4j
public class CredentialController {

    private final CredentialService credentialService;

    @PostMapping
    public ResponseEntity<CreateCredentialResponse> createCredential(@Valid @RequestBody Credential credential) {
        log.info("Create credential request received for title '{}'", credential.getTitle());
        String id = credentialService.createCredential(credential);
        return ResponseEntity.ok(new CreateCredentialResponse(id));
    }

    @GetMapping
    public ResponseEntity<List<CredentialOut>> listCredentials(
            @RequestParam(name = "q", required = false) String q
    ) {
        return ResponseEntity.ok(credentialService.listCredentials(q));
    }
}
