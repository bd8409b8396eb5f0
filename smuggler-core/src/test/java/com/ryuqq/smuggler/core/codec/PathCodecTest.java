package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.error.BadKeyException;
import com.ryuqq.smuggler.core.error.ErrorKind;
import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.QualifiedName;
import com.ryuqq.smuggler.core.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PathCodec 테스트.
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
class PathCodecTest {

    private final PathCodec codec = new PathCodec();

    // ========== encode ==========

    @Test
    void encode_MixedSegments_JoinedWithTag() {
        // Given
        List<Identifier> path = List.of(Symbol.of("api"), QualifiedName.of("Api.Repo"), Symbol.of("priv"));

        // When
        String key = codec.encode(path);

        // Then
        assertEquals("elixir-api-Api.Repo-priv", key);
    }

    @Test
    void encode_CustomTag_UsesTag() {
        assertEquals("cfg-app-key", new PathCodec("cfg").encode(List.of(Symbol.of("app"), Symbol.of("key"))));
    }

    @Test
    void encode_EmptyPath_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> codec.encode(List.of()));
    }

    // ========== decode ==========

    @Test
    void decode_ValidKey_ClassifiesSegments() {
        // When
        List<Identifier> segments = codec.decode("elixir-api-Api.Repo-priv");

        // Then
        assertEquals(List.of(Symbol.of("api"), QualifiedName.of("Api.Repo"), Symbol.of("priv")), segments);
    }

    @Test
    void decode_MissingTag_ThrowsBadKey() {
        BadKeyException exception = assertThrows(BadKeyException.class, () -> codec.decode("other-app-key"));
        assertEquals(ErrorKind.BAD_KEY, exception.kind());
    }

    @Test
    void decode_EmptySegment_ThrowsBadKey() {
        assertThrows(BadKeyException.class, () -> codec.decode("elixir-app--key"));
        assertThrows(BadKeyException.class, () -> codec.decode("elixir-app-key-"));
        assertThrows(BadKeyException.class, () -> codec.decode("elixir-"));
    }

    @Test
    void decode_InvalidSegment_ThrowsBadKey() {
        assertThrows(BadKeyException.class, () -> codec.decode("elixir-app-123"));
        assertThrows(BadKeyException.class, () -> codec.decode("elixir-app-bad key"));
    }

    @Test
    void decode_Null_ThrowsBadKey() {
        assertThrows(BadKeyException.class, () -> codec.decode(null));
    }

    @Test
    void decodeEntryPath_AppOnly_ThrowsBadKey() {
        assertThrows(BadKeyException.class, () -> codec.decodeEntryPath("elixir-my_app"));
    }

    @Test
    void decodeEntryPath_SplitsAppAndPath() {
        // When
        EntryPath path = codec.decodeEntryPath("elixir-my_app-url-port");

        // Then
        assertEquals(Symbol.of("my_app"), path.app());
        assertEquals(List.of(Symbol.of("url"), Symbol.of("port")), path.path());
    }

    // ========== 생성자 ==========

    @Test
    void constructor_TagWithSeparator_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new PathCodec("my-tag"));
        assertThrows(IllegalArgumentException.class, () -> new PathCodec(" "));
    }
}
