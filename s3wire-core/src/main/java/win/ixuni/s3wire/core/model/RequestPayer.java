package win.ixuni.s3wire.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Known values of the x-amz-request-payer header
 */
@Getter
@RequiredArgsConstructor
public enum RequestPayer {

    REQUESTER("requester");

    private final String value;
}
