package common.util;

import common.naming.Endpoint;
import common.naming.EndpointStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressUtil 测试")
class AddressUtilTest {

    @Test
    @DisplayName("host:port 与节点之间互相转换")
    void shouldConvertBetweenStringAndEndpoint() {
        Endpoint endpoint = AddressUtil.toEndpoint("192.168.1.1:8001", EndpointStatus.ISOLATED);
        assertEquals(new Endpoint("192.168.1.1", 8001, EndpointStatus.ISOLATED), endpoint);
        assertEquals("192.168.1.1:8001", AddressUtil.toString(endpoint));
    }

    @Test
    @DisplayName("转换为未解析的网络地址")
    void shouldConvertToUnresolvedAddress() {
        InetSocketAddress address = AddressUtil.toSocketAddress(Endpoint.healthy("service.local", 9000));
        assertTrue(address.isUnresolved());
        assertEquals("service.local:9000", AddressUtil.toString(address));
        assertEquals(address.getPort(), AddressUtil.fromString("127.0.0.1:9000").getPort());
    }

    @ParameterizedTest
    @ValueSource(strings = {"no-port", ":8080", "host:", "host:abc", "host:70000"})
    @DisplayName("非法地址抛出 IllegalArgumentException")
    void shouldRejectMalformedAddress(String address) {
        assertThrows(IllegalArgumentException.class, () -> AddressUtil.toEndpoint(address, EndpointStatus.HEALTHY));
    }
}
