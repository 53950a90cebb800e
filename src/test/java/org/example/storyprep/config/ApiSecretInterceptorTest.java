package org.example.storyprep.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiSecretInterceptorTest {

    @Test
    void preHandle_noSecretConfigured_allowsEverything() throws Exception {
        ApiSecretInterceptor interceptor = new ApiSecretInterceptor("");

        assertTrue(interceptor.preHandle(new MockHttpServletRequest("POST", "/api/stories"),
                new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_matchingBearer_isAllowed() throws Exception {
        ApiSecretInterceptor interceptor = new ApiSecretInterceptor("s3cret");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/delivery/send-next");
        request.addHeader("Authorization", "Bearer s3cret");

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_wrongOrMissingBearer_isRejectedWithJson() throws Exception {
        ApiSecretInterceptor interceptor = new ApiSecretInterceptor("s3cret");
        MockHttpServletRequest wrong = new MockHttpServletRequest("POST", "/api/stories");
        wrong.addHeader("Authorization", "Bearer nope");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertFalse(interceptor.preHandle(wrong, response, new Object()));
        assertEquals(401, response.getStatus());
        assertEquals("{\"error\":\"Unauthorized\"}", response.getContentAsString());

        MockHttpServletRequest missing = new MockHttpServletRequest("GET", "/api/stories");
        assertFalse(interceptor.preHandle(missing, new MockHttpServletResponse(), new Object()));
    }
}
