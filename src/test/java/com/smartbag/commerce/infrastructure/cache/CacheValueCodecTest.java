package com.smartbag.commerce.infrastructure.cache;

import com.smartbag.commerce.domain.inventory.ReservationRecord;
import com.smartbag.commerce.infrastructure.config.CacheConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CacheValueCodec 단위 테스트
 *
 * - JSON 우선 인코딩, 타입 정보 복원
 * - JSON 으로 표현할 수 없는 값의 바이너리 대체
 * - 해석 불가능한 데이터 처리
 */
@DisplayName("CacheValueCodec 단위 테스트")
class CacheValueCodecTest {

    private CacheValueCodec codec;

    @BeforeEach
    void setUp() {
        codec = new CacheValueCodec(new CacheConfig().cacheObjectMapper());
    }

    @Test
    @DisplayName("일반 객체는 JSON 으로 인코딩되고 원래 타입으로 복원된다")
    void encode_PlainObject_UsesJson() {
        // Given
        ReservationRecord record = new ReservationRecord("ORD1", "P1", 3, LocalDateTime.of(2025, 1, 1, 12, 0));

        // When
        byte[] bytes = codec.encode(record);
        Object decoded = codec.decode(bytes);

        // Then
        assertThat(codec.isBinary(bytes)).isFalse();
        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"orderId\":\"ORD1\"");
        assertThat(decoded).isInstanceOf(ReservationRecord.class);
        ReservationRecord restored = (ReservationRecord) decoded;
        assertThat(restored.getProductId()).isEqualTo("P1");
        assertThat(restored.getQuantity()).isEqualTo(3);
        assertThat(restored.getReservedAt()).isEqualTo(LocalDateTime.of(2025, 1, 1, 12, 0));
    }

    @Test
    @DisplayName("정수 값은 타입 정보 없이 숫자 그대로 저장된다 (INCRBY 호환)")
    void encode_Integer_PlainNumber() {
        byte[] bytes = codec.encode(42L);

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("42");
        assertThat(codec.decode("7".getBytes(StandardCharsets.UTF_8))).isInstanceOf(Number.class);
    }

    @Test
    @DisplayName("자기 참조 객체는 JDK 직렬화 바이너리로 대체된다")
    void encode_SelfReferencingSerializable_FallsBackToBinary() {
        // Given
        Node node = new Node("root");
        node.next = node;

        // When
        byte[] bytes = codec.encode(node);
        Object decoded = codec.decode(bytes);

        // Then
        assertThat(codec.isBinary(bytes)).isTrue();
        assertThat(decoded).isInstanceOf(Node.class);
        Node restored = (Node) decoded;
        assertThat(restored.name).isEqualTo("root");
        assertThat(restored.next).isSameAs(restored);
    }

    @Test
    @DisplayName("JSON 도 바이너리도 불가능한 값은 CacheCodecException")
    void encode_NotSerializable_Throws() {
        PlainNode node = new PlainNode();
        node.next = node;

        assertThatThrownBy(() -> codec.encode(node))
                .isInstanceOf(CacheCodecException.class);
    }

    @Test
    @DisplayName("해석할 수 없는 데이터는 CacheCodecException")
    void decode_Garbage_Throws() {
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CacheCodecException.class);
        assertThatThrownBy(() -> codec.decode(new byte[]{(byte) 0xAC, (byte) 0xED, 0x00, 0x01}))
                .isInstanceOf(CacheCodecException.class);
    }

    @Test
    @DisplayName("컬렉션은 구체 타입과 함께 저장된다")
    void encode_ArrayList_KeepsElements() {
        List<String> values = new ArrayList<>();
        values.add("a");
        values.add("b");

        Object decoded = codec.decode(codec.encode(values));

        assertThat(decoded).isInstanceOf(ArrayList.class);
        assertThat((List<Object>) decoded).containsExactly("a", "b");
    }

    static class Node implements Serializable {
        private static final long serialVersionUID = 1L;

        private String name;
        private Node next;

        Node() {
        }

        Node(String name) {
            this.name = name;
        }
    }

    static class PlainNode {
        private PlainNode next;
    }
}
