package com.ryuqq.smuggler.core.transform;

import com.ryuqq.smuggler.core.codec.EntryPath;
import com.ryuqq.smuggler.core.codec.PathCodec;
import com.ryuqq.smuggler.core.codec.ValueCodec;
import com.ryuqq.smuggler.core.error.BadKeyException;
import com.ryuqq.smuggler.core.error.BadValueException;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.outcome.DecodedEntry;
import com.ryuqq.smuggler.core.outcome.EntryOutcome;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;

/**
 * 인코딩된 (키, 값) 한 쌍을 독립적으로 디코딩.
 *
 * <p>키 오류는 {@code BAD_KEY}, 값 오류는 {@code BAD_VALUE}인 {@link InvalidEntry}로 반환되며
 * 예외를 던지지 않습니다. 키가 먼저 검사되므로 둘 다 잘못된 경우 {@code BAD_KEY}입니다.</p>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public final class EntryDecoder {

    private final PathCodec pathCodec;
    private final ValueCodec valueCodec;

    public EntryDecoder(PathCodec pathCodec, ValueCodec valueCodec) {
        if (pathCodec == null) {
            throw new IllegalArgumentException("pathCodec cannot be null");
        }
        if (valueCodec == null) {
            throw new IllegalArgumentException("valueCodec cannot be null");
        }
        this.pathCodec = pathCodec;
        this.valueCodec = valueCodec;
    }

    /**
     * 한 쌍 디코딩.
     *
     * @param key 인코딩된 키
     * @param value 인코딩된 값
     * @return DecodedEntry 또는 InvalidEntry
     */
    public EntryOutcome decode(String key, String value) {
        EntryPath path;
        try {
            path = pathCodec.decodeEntryPath(key);
        } catch (BadKeyException e) {
            return InvalidEntry.badKey(key, value, e.getMessage());
        }

        Literal literal;
        try {
            literal = valueCodec.decode(value);
        } catch (BadValueException e) {
            return InvalidEntry.badValue(key, value, e.getMessage());
        }

        return new DecodedEntry(key, value, path.app(), TreeMerger.nest(path.path(), literal));
    }
}
