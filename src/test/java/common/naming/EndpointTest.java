package common.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Endpoint 测试")
class EndpointTest {

    @Test
    @DisplayName("比较 host、port、status 三元组")
    void shouldCompareTriple() {
        Endpoint endpoint = Endpoint.healthy("10.0.0.1", 80);
        assertTrue(endpoint.sameAs(Endpoint.healthy("10.0.0.1", 80)));
        assertFalse(endpoint.sameAs(new Endpoint("10.0.0.1", 80, EndpointStatus.UNHEALTHY)));
        assertFalse(endpoint.sameAs(Endpoint.healthy("10.0.0.1", 81)));
        assertFalse(endpoint.sameAs(null));
    }

    @Test
    @DisplayName("构造参数校验")
    void shouldValidateArguments() {
        assertThrows(NullPointerException.class, () -> new Endpoint(null, 80, EndpointStatus.HEALTHY));
        assertThrows(NullPointerException.class, () -> new Endpoint("10.0.0.1", 80, null));
        assertThrows(IllegalArgumentException.class, () -> Endpoint.healthy("10.0.0.1", -1));
    }

    @Test
    @DisplayName("解析节点状态，无法识别时视为健康")
    void shouldParseStatus() {
        assertEquals(EndpointStatus.UNHEALTHY, EndpointStatus.parse(" unhealthy "));
        assertEquals(EndpointStatus.ISOLATED, EndpointStatus.parse("ISOLATED"));
        assertEquals(EndpointStatus.HEALTHY, EndpointStatus.parse(null));
        assertEquals(EndpointStatus.HEALTHY, EndpointStatus.parse("unknown"));
    }
}
