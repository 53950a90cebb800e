package org.example.storyprep.controller;

import org.example.storyprep.model.DeliveryOutcome;
import org.example.storyprep.service.delivery.ChunkNotFoundException;
import org.example.storyprep.service.delivery.DeliveryScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DeliveryController.class)
class DeliveryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DeliveryScheduler deliveryScheduler;

    @Test
    void sendNext_delivered_returnsOk() throws Exception {
        when(deliveryScheduler.deliverNext()).thenReturn(new DeliveryOutcome(DeliveryOutcome.Status.DELIVERED,
                "c-1", "s-1", "Signal", 1, 3, "reader@kindle.example.com", "Delivered part 1 of 3"));

        mockMvc.perform(post("/api/delivery/send-next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELIVERED"))
                .andExpect(jsonPath("$.chunkNumber").value(1))
                .andExpect(jsonPath("$.totalChunks").value(3));
    }

    @Test
    void sendNext_queueEmpty_isNotAnError() throws Exception {
        when(deliveryScheduler.deliverNext()).thenReturn(DeliveryOutcome.queueEmpty());

        mockMvc.perform(post("/api/delivery/send-next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("QUEUE_EMPTY"));
    }

    @Test
    void sendNext_transportFailure_returnsBadGateway() throws Exception {
        when(deliveryScheduler.deliverNext()).thenReturn(new DeliveryOutcome(DeliveryOutcome.Status.FAILED,
                "c-1", "s-1", "Signal", 2, 3, "reader@kindle.example.com", "Delivery failed: SMTP down"));

        mockMvc.perform(post("/api/delivery/send-next"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Delivery failed: SMTP down"));
    }

    @Test
    void resetChunk_known_returnsConfirmation() throws Exception {
        mockMvc.perform(post("/api/delivery/chunks/c-1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunkId").value("c-1"))
                .andExpect(jsonPath("$.reset").value(true));

        verify(deliveryScheduler).resetChunk("c-1");
    }

    @Test
    void resetChunk_unknown_returnsNotFound() throws Exception {
        doThrow(new ChunkNotFoundException("missing")).when(deliveryScheduler).resetChunk("missing");

        mockMvc.perform(post("/api/delivery/chunks/missing/reset"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Chunk not found: missing"));
    }
}
