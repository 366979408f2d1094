package com.eventhub.registration.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.junit.jupiter.api.Assertions.*;

class OperatorAuthFilterTest {

    private RegistrationProperties properties;
    private OperatorAuthFilter filter;

    @BeforeEach
    void setUp() {
        properties = new RegistrationProperties();
        properties.setOperatorToken("s3cret-operator-token");
        filter = new OperatorAuthFilter(properties);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest adminRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/admin/registrations/x/check-in");
        request.setRequestURI("/admin/registrations/x/check-in");
        return request;
    }

    @Test
    @DisplayName("valid token passes and names the operator")
    void validToken() throws Exception {
        MockHttpServletRequest request = adminRequest();
        request.addHeader("X-Operator-Token", "s3cret-operator-token");
        request.addHeader(OperatorAuthFilter.OPERATOR_NAME_HEADER, "front-desk");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals("front-desk", request.getAttribute(OperatorAuthFilter.OPERATOR_ATTRIBUTE));
        assertEquals("front-desk", SecurityContextHolder.getContext().getAuthentication().getName());
    }

    @Test
    @DisplayName("wrong or missing token is 401")
    void wrongToken() throws Exception {
        MockHttpServletRequest request = adminRequest();
        request.addHeader("X-Operator-Token", "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertNull(chain.getRequest());
    }

    @Test
    @DisplayName("unset operator token locks the admin routes")
    void unsetTokenLocks() throws Exception {
        properties.setOperatorToken("");
        MockHttpServletRequest request = adminRequest();
        request.addHeader("X-Operator-Token", "");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("public routes are not filtered")
    void publicRoutesSkipped() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/public/events/e1/codes");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(200, response.getStatus());
        assertNotNull(((MockFilterChain) chain).getRequest());
    }
}
