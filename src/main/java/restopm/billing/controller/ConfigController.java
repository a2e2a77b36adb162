package restopm.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.dto.SequenceEstimateResponse;
import restopm.billing.service.ConfigService;

@RestController
@RequestMapping(path = "/api/config", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Configuration", description = "Restaurant and billing configuration endpoints")
public class ConfigController {

    private final ConfigService configService;

    @GetMapping
    @Operation(summary = "Get configuration", description = "Cached restaurant configuration")
    public ResponseEntity<RestaurantConfigDTO> getConfig() {
        return ResponseEntity.ok(configService.current());
    }

    @PatchMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update configuration", description = "Merge the given fields into the stored configuration")
    public ResponseEntity<RestaurantConfigDTO> updateConfig(@RequestBody RestaurantConfigDTO changes) {
        return ResponseEntity.ok(configService.update(changes));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh configuration", description = "Fetch the configuration from the backend again")
    public ResponseEntity<RestaurantConfigDTO> refresh() {
        return ResponseEntity.ok(configService.refresh());
    }

    @GetMapping("/next-sequence")
    @Operation(summary = "Next document numbers", description = "Estimated next invoice and credit note numbers")
    public ResponseEntity<SequenceEstimateResponse> nextSequence() {
        return ResponseEntity.ok(configService.nextSequence());
    }
}
