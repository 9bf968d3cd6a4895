package io.jobgtm.support;

import io.jobgtm.retry.NonRetryableException;

/**
 * A message body or collaborator response that is not valid JSON for the expected type.
 */
public class MalformedPayloadException extends NonRetryableException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
