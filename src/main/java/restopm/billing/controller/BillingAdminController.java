package restopm.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.dto.ConfirmationRequest;
import restopm.billing.service.BillingAdminService;
import restopm.billing.service.ConfigService;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Administration", description = "Destructive maintenance endpoints")
public class BillingAdminController {

    private final BillingAdminService billingAdminService;
    private final ConfigService configService;

    /**
     * Wipe bills and credit notes and reset the sequences.
     * The body must carry the exact phrase ELIMINAR TODO.
     */
    @PostMapping("/billing/reset")
    @Operation(summary = "Reset billing system", description = "Requires confirmation \"ELIMINAR TODO\"")
    public ResponseEntity<Map<String, Object>> resetBilling(@Valid @RequestBody ConfirmationRequest request) {
        billingAdminService.resetBillingSystem(request.getConfirmation());

        Map<String, Object> response = new HashMap<>();
        response.put("status", "reset");
        response.put("message", "Sistema de facturación reiniciado");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/config/reset")
    @Operation(summary = "Restore default configuration", description = "Requires confirmation \"RESTAURAR CONFIG\"")
    public ResponseEntity<RestaurantConfigDTO> resetConfig(@Valid @RequestBody ConfirmationRequest request) {
        return ResponseEntity.ok(configService.resetToDefaults(request.getConfirmation()));
    }
}
