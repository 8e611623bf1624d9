package com.scanreward.api.token.exceptions;

import lombok.Getter;
import lombok.NonNull;

import java.util.Collection;
import java.util.Set;

/**
 * Thrown by insertBatch operation in TokenStore if a token id in the batch is not unique.
 */
@Getter
public class DuplicateTokenIdException extends Exception {

    /**
     * Colliding ids, if known.
     */
    private final Set<String> ids;

    public DuplicateTokenIdException(@NonNull Collection<String> ids) {
        super(String.format("%d token id(s) collided with existing ids", ids.size()));
        this.ids = Set.copyOf(ids);
    }

    public DuplicateTokenIdException(String message, Throwable cause) {
        super(message, cause);
        this.ids = Set.of();
    }
}
