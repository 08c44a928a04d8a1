package com.xammer.fleet.controller;

import com.xammer.fleet.domain.CapacitySettings;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.ProvisioningPlan;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.TemplateGeneration;
import com.xammer.fleet.dto.CapacityUpdateRequest;
import com.xammer.fleet.dto.DispatcherStatusDto;
import com.xammer.fleet.dto.FleetDefinitionRequest;
import com.xammer.fleet.dto.TemplateUpdateRequest;
import com.xammer.fleet.service.FleetOrchestrationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/fleets")
public class FleetController {

    private final FleetOrchestrationService fleetService;

    public FleetController(FleetOrchestrationService fleetService) {
        this.fleetService = fleetService;
    }

    @PostMapping
    public ResponseEntity<FleetState> createFleet(@RequestBody FleetDefinitionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(fleetService.createFleet(request));
    }

    // Dry run, nothing is provisioned
    @PostMapping("/plan")
    public ResponseEntity<ProvisioningPlan> plan(@RequestBody FleetDefinitionRequest request) {
        return ResponseEntity.ok(fleetService.plan(request));
    }

    @GetMapping
    public ResponseEntity<List<FleetState>> listFleets() {
        return ResponseEntity.ok(fleetService.list());
    }

    @GetMapping("/{fleetId}")
    public ResponseEntity<FleetState> describe(@PathVariable String fleetId) {
        return ResponseEntity.ok(fleetService.describe(fleetId));
    }

    @PutMapping("/{fleetId}/capacity")
    public ResponseEntity<CapacitySettings> updateCapacity(@PathVariable String fleetId,
            @RequestBody CapacityUpdateRequest request) {
        return ResponseEntity.ok(fleetService.updateCapacity(fleetId, request));
    }

    @PutMapping("/{fleetId}/template")
    public ResponseEntity<Map<String, Object>> replaceTemplate(@PathVariable String fleetId,
            @RequestBody TemplateUpdateRequest request) {
        TemplateGeneration generation = fleetService.replaceTemplate(fleetId, request);
        Map<String, Object> body = new HashMap<>();
        body.put("generation", generation.getNumber());
        body.put("instanceType", generation.getInstanceType());
        body.put("amiReference", generation.getAmiReference());
        body.put("templateRef", generation.getTemplateRef());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{fleetId}/refresh")
    public ResponseEntity<RefreshOutcome> startRefresh(@PathVariable String fleetId) {
        RefreshOutcome outcome = fleetService.startRefresh(fleetId);
        HttpStatus status = outcome.isAccepted() ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(outcome);
    }

    @GetMapping("/{fleetId}/dispatcher")
    public ResponseEntity<DispatcherStatusDto> dispatcherStatus(@PathVariable String fleetId) {
        return ResponseEntity.ok(fleetService.dispatcherStatus(fleetId));
    }

    @DeleteMapping("/{fleetId}")
    public ResponseEntity<Void> deleteFleet(@PathVariable String fleetId) {
        fleetService.deleteFleet(fleetId);
        return ResponseEntity.noContent().build();
    }
}
