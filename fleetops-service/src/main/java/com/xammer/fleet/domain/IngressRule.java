package com.xammer.fleet.domain;

import lombok.Value;

/**
 * A single TCP ingress permission. {@code source} is either a CIDR block or a security group id.
 */
@Value
public class IngressRule {
    int port;
    String source;
}
