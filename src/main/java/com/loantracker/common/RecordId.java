package com.loantracker.common;

import com.loantracker.common.exception.MalformedRecordIdException;
import org.bson.types.ObjectId;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value object for a store-assigned record identifier.
 *
 * Wraps the document store's native id. Cross-collection references are always
 * stored as the canonical string form returned by {@link #toString()}.
 */
public final class RecordId {

    private final ObjectId value;

    private RecordId(ObjectId value) {
        this.value = value;
    }

    public static RecordId generate() {
        return new RecordId(new ObjectId());
    }

    /**
     * Parse an identifier in either hex case; {@link #toString()} gives back the
     * canonical lower-case form.
     *
     * @throws MalformedRecordIdException if the text is not a valid identifier
     */
    public static RecordId parse(String text) {
        if (!isValid(text)) {
            throw new MalformedRecordIdException(text);
        }
        return new RecordId(new ObjectId(text));
    }

    public static Optional<RecordId> tryParse(String text) {
        return isValid(text) ? Optional.of(new RecordId(new ObjectId(text))) : Optional.empty();
    }

    private static boolean isValid(String text) {
        return text != null && ObjectId.isValid(text);
    }

    public ObjectId toObjectId() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordId)) {
            return false;
        }
        return value.equals(((RecordId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value.toHexString();
    }
}
