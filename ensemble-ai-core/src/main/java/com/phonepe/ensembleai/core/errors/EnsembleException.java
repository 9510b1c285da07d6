/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.ensembleai.core.errors;

import lombok.Getter;

/**
 * Raised for configuration and registry failures. {@link com.phonepe.ensembleai.core.client.TextGenerator}
 * implementations also throw this to tell the client which class of failure occurred.
 */
@Getter
public class EnsembleException extends RuntimeException {
    private final transient EnsembleError error;

    public EnsembleException(EnsembleError error) {
        super(error.getMessage());
        this.error = error;
    }

    public EnsembleException(EnsembleError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static EnsembleException of(ErrorType errorType, Object... args) {
        return new EnsembleException(EnsembleError.error(errorType, args));
    }

    public static EnsembleException transientFailure(String message, Throwable cause) {
        return new EnsembleException(EnsembleError.error(ErrorType.TRANSIENT, message), cause);
    }

    public static EnsembleException rateLimited(String message) {
        return of(ErrorType.RATE_LIMITED, message);
    }

    public static EnsembleException nonRetryable(String message) {
        return of(ErrorType.NON_RETRYABLE, message);
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
