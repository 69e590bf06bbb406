package com.roapid.domain;

import com.roapid.common.RoapidException;
import com.roapid.common.SyncErrorKind;

/**
 * Thrown when a category label does not follow {@code Category:<prefix>-<type>-<id>}.
 */
public class InvalidCategoryException extends RoapidException {

    public InvalidCategoryException(String category) {
        super(SyncErrorKind.INVALID_FORMAT, "invalid category format: " + category);
    }
}
