package in.sessiongate.security;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InputValidator.
 *
 * Tests:
 * - Phone normalization and JID construction
 * - Session names, notes and slugs
 * - Ack wait clamping
 */
class InputValidatorTest {

    @Test
    void testNormalizePhone() {
        assertEquals("5511987654321", InputValidator.normalizePhone("+55 (11) 98765-4321"));
        assertEquals("5511987654321", InputValidator.normalizePhone("11987654321"), "Local number gets the country code");
        assertEquals("551133334444", InputValidator.normalizePhone("1133334444"), "Ten-digit landline");
        assertNull(InputValidator.normalizePhone("12345"));
        assertNull(InputValidator.normalizePhone("441234567890123"));
        assertNull(InputValidator.normalizePhone(null));
    }

    @Test
    void testToJid() {
        assertEquals("5511987654321@s.whatsapp.net", InputValidator.toJid("11987654321"));
        assertEquals("120363@g.us", InputValidator.toJid(" 120363@g.us "), "Full JIDs pass through");

        GatewayException blank = assertThrows(GatewayException.class, () -> InputValidator.toJid(" "));
        assertEquals(ErrorCode.INVALID_RECIPIENT, blank.getErrorCode());
        GatewayException bad = assertThrows(GatewayException.class, () -> InputValidator.toJid("abc"));
        assertEquals(ErrorCode.INVALID_RECIPIENT, bad.getErrorCode());
    }

    @Test
    void testSessionName() {
        assertEquals("Sales", InputValidator.sessionName("  Sales "));
        assertEquals(ErrorCode.NAME_EMPTY,
            assertThrows(GatewayException.class, () -> InputValidator.sessionName("")).getErrorCode());
        assertEquals(ErrorCode.NAME_INVALID,
            assertThrows(GatewayException.class, () -> InputValidator.sessionName("x".repeat(81))).getErrorCode());
    }

    @Test
    void testNote() {
        assertEquals("", InputValidator.note(null));
        assertEquals("hello", InputValidator.note("  hello  "));
        assertEquals(InputValidator.MAX_NOTE_LENGTH, InputValidator.note("n".repeat(400)).length(), "Long notes are cut");
    }

    @Test
    void testSlug() {
        assertEquals("sales-team-1", InputValidator.slug("Sales Team #1"));
        assertEquals("a_b", InputValidator.slug("--A_B--"), "Underscores are word characters");
        assertNull(InputValidator.slug("###"));
    }

    @Test
    void testWaitAckClamped() {
        assertEquals(0, InputValidator.waitAckMs(-5));
        assertEquals(1_500, InputValidator.waitAckMs(1_500));
        assertEquals(60_000, InputValidator.waitAckMs(600_000));
    }
}
