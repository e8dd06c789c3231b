/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.browser.domain.exception;

/**
 * Unchecked failure raised by the session and task orchestration layer.
 *
 * <p>
 * Every error that leaves the domain layer is an instance of this class with
 * an {@link ErrorKind}; the web adapter maps the kind to an HTTP status and
 * the message to the {@code detail} field of the error envelope.
 */
public class OrchestrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static OrchestrationException conflict(String message) {
        return new OrchestrationException(ErrorKind.CONFLICT, message);
    }

    public static OrchestrationException notFound(String message) {
        return new OrchestrationException(ErrorKind.NOT_FOUND, message);
    }

    public static OrchestrationException invalidParameters(String message) {
        return new OrchestrationException(ErrorKind.INVALID_PARAMETERS, message);
    }

    public static OrchestrationException domainNotAllowed(String message) {
        return new OrchestrationException(ErrorKind.DOMAIN_NOT_ALLOWED, message);
    }

    public static OrchestrationException provisioning(String message, Throwable cause) {
        return new OrchestrationException(ErrorKind.PROVISIONING_ERROR, message, cause);
    }

    public static OrchestrationException upstream(String message) {
        return new OrchestrationException(ErrorKind.UPSTREAM_FAILURE, message);
    }

    public static OrchestrationException upstream(String message, Throwable cause) {
        return new OrchestrationException(ErrorKind.UPSTREAM_FAILURE, message, cause);
    }

    public static OrchestrationException timeout(String message) {
        return new OrchestrationException(ErrorKind.TIMEOUT, message);
    }

    public static OrchestrationException unknownOperation(String operationName) {
        return new OrchestrationException(ErrorKind.UNKNOWN_OPERATION, "Unknown operation: " + operationName);
    }

    /**
     * Classifies an arbitrary failure coming out of an external capability.
     * Orchestration errors pass through unchanged.
     */
    public static OrchestrationException classify(Throwable failure) {
        if (failure instanceof OrchestrationException orchestrationException) {
            return orchestrationException;
        }
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            message = failure.getClass().getSimpleName();
        }
        return upstream(message, failure);
    }
}
