package com.openmandi.pricing.audit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NegotiationAuditLoggerTest {

    @Test
    void partyIdsAreMasked() {
        assertEquals("****er-1", NegotiationAuditLogger.redact("farmer-1"));
        assertEquals("****", NegotiationAuditLogger.redact("abc"));
        assertEquals("unknown", NegotiationAuditLogger.redact(null));
        assertEquals("unknown", NegotiationAuditLogger.redact(" "));
    }
}
