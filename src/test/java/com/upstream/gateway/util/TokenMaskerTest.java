package com.upstream.gateway.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenMaskerTest {

    @Test
    void mask_keepsFirstEightCharacters() {
        assertEquals("sk-proj-***", TokenMasker.mask("sk-proj-abcdef123456"));
    }

    @Test
    void mask_shortOrMissingToken_isFullyHidden() {
        assertEquals("***", TokenMasker.mask(null));
        assertEquals("***", TokenMasker.mask("12345678"));
    }
}
