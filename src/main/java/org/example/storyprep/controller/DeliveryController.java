package org.example.storyprep.controller;

import org.example.storyprep.model.DeliveryOutcome;
import org.example.storyprep.service.delivery.DeliveryScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/delivery")
public class DeliveryController {

    private final DeliveryScheduler deliveryScheduler;

    public DeliveryController(DeliveryScheduler deliveryScheduler) {
        this.deliveryScheduler = deliveryScheduler;
    }

    @PostMapping("/send-next")
    public ResponseEntity<DeliveryOutcome> sendNext() {
        DeliveryOutcome outcome = deliveryScheduler.deliverNext();
        HttpStatus status = outcome.status() == DeliveryOutcome.Status.FAILED ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcome);
    }

    @PostMapping("/chunks/{chunkId}/reset")
    public Map<String, Object> resetChunk(@PathVariable String chunkId) {
        deliveryScheduler.resetChunk(chunkId);
        return Map.of("chunkId", chunkId, "reset", true);
    }
}
