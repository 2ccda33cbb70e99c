package com.cred.freestyle.eventpricing.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AdminApiKeyAuthenticationFilter.
 */
@DisplayName("AdminApiKeyAuthenticationFilter Unit Tests")
class AdminApiKeyAuthenticationFilterTest {

    private final AdminApiKeyAuthenticationFilter filter = new AdminApiKeyAuthenticationFilter("s3cret-key");

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private MockFilterChain runFilter(String authorizationHeader) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/events");
        if (authorizationHeader != null) {
            request.addHeader("Authorization", authorizationHeader);
        }
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        return chain;
    }

    @Test
    @DisplayName("Matching bearer key authenticates as admin")
    void matchingKey_AuthenticatesAdmin() throws Exception {
        MockFilterChain chain = runFilter("Bearer s3cret-key");

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo("admin");
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly(AdminApiKeyAuthenticationFilter.ADMIN_ROLE);
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("Wrong key leaves the request unauthenticated but continues the chain")
    void wrongKey_Unauthenticated() throws Exception {
        MockFilterChain chain = runFilter("Bearer guess");

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("Missing or non-bearer header is ignored")
    void noBearerHeader_Unauthenticated() throws Exception {
        runFilter(null);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();

        runFilter("Basic czNjcmV0LWtleQ==");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
