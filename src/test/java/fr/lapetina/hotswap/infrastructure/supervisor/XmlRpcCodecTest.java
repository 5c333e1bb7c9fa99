package fr.lapetina.hotswap.infrastructure.supervisor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlRpcCodecTest {

    private static byte[] xml(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should encode a call with typed parameters")
    void shouldEncodeCall() {
        String call = XmlRpcCodec.encodeCall("supervisor.startProcessGroup", "greeter-a", Boolean.TRUE, 3);

        assertThat(call)
                .contains("<methodName>supervisor.startProcessGroup</methodName>")
                .contains("<value><string>greeter-a</string></value>")
                .contains("<value><boolean>1</boolean></value>")
                .contains("<value><int>3</int></value>");
    }

    @Test
    @DisplayName("should escape markup in strings")
    void shouldEscapeMarkup() {
        String call = XmlRpcCodec.encodeCall("m", "a<b & \"c\">");

        assertThat(call).contains("<string>a&lt;b &amp; &quot;c&quot;&gt;</string>");
    }

    @Test
    @DisplayName("should decode an array of structs")
    void shouldDecodeArrayOfStructs() throws Exception {
        Object result = XmlRpcCodec.decodeResponse(xml("""
                <?xml version="1.0"?>
                <methodResponse><params><param><value><array><data>
                  <value><struct>
                    <member><name>group</name><value><string>greeter-a</string></value></member>
                    <member><name>state</name><value><int>20</int></value></member>
                    <member><name>statename</name><value>RUNNING</value></member>
                  </struct></value>
                </data></array></value></param></params></methodResponse>
                """));

        assertThat(result).isInstanceOf(List.class);
        List<?> list = (List<?>) result;
        assertThat(list).hasSize(1);
        assertThat(list.get(0))
                .isEqualTo(Map.of("group", "greeter-a", "state", 20, "statename", "RUNNING"));
    }

    @Test
    @DisplayName("should decode scalars")
    void shouldDecodeScalars() throws Exception {
        assertThat(XmlRpcCodec.decodeResponse(xml(
                "<methodResponse><params><param><value><boolean>1</boolean></value></param></params></methodResponse>")))
                .isEqualTo(true);
        assertThat(XmlRpcCodec.decodeResponse(xml(
                "<methodResponse><params><param><value><i4>42</i4></value></param></params></methodResponse>")))
                .isEqualTo(42);
        assertThat(XmlRpcCodec.decodeResponse(xml(
                "<methodResponse><params><param><value><double>1.5</double></value></param></params></methodResponse>")))
                .isEqualTo(1.5);
    }

    @Test
    @DisplayName("should surface a fault with its code")
    void shouldSurfaceFault() {
        byte[] fault = xml("""
                <methodResponse><fault><value><struct>
                  <member><name>faultCode</name><value><int>10</int></value></member>
                  <member><name>faultString</name><value><string>BAD_NAME: nope</string></value></member>
                </struct></value></fault></methodResponse>
                """);

        assertThatThrownBy(() -> XmlRpcCodec.decodeResponse(fault))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("BAD_NAME")
                .satisfies(e -> assertThat(((GatewayException) e).getFaultCode()).isEqualTo(10));
    }

    @Test
    @DisplayName("should reject malformed documents")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> XmlRpcCodec.decodeResponse(xml("<methodResponse><params>")))
                .isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> XmlRpcCodec.decodeResponse(xml("<other/>")))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("other");
        assertThatThrownBy(() -> XmlRpcCodec.decodeResponse(xml("""
                <?xml version="1.0"?>
                <!DOCTYPE x [<!ENTITY e "boom">]>
                <methodResponse><params><param><value>&e;</value></param></params></methodResponse>
                """)))
                .isInstanceOf(GatewayException.class);
    }
}
