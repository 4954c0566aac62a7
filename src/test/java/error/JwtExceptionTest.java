package error;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class JwtExceptionTest {

    @Test
    public void testEqualityUsesTypeAndMessage() {
        JwtException a = new JwtException(ErrorType.Certificate, "Signature does not match certificate");
        JwtException b = new JwtException(ErrorType.Certificate, "Signature does not match certificate");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new JwtException(ErrorType.Invalid, "Signature does not match certificate"));
        assertNotEquals(a, new JwtException(ErrorType.Certificate, "Sign message"));
    }

    @Test
    public void testRendering() {
        JwtException e = new JwtException(ErrorType.Invalid, "JWT does not have 3 segments");
        assertEquals("Invalid: JWT does not have 3 segments", e.toString());
        assertEquals("Invalid: JWT does not have 3 segments", e.getMessage());
        assertEquals("JWT does not have 3 segments", e.getMsg());
    }
}
