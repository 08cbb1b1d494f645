package com.questrail.idscan.protocol.aamva.codec.impl;

/**
 * Raised by {@link AamvaHeaderReader} when the payload carries no usable
 * issuer header. Never escapes this package.
 */
final class HeaderFormatException extends Exception
{
    HeaderFormatException(String message) {
        super(message);
    }
}
