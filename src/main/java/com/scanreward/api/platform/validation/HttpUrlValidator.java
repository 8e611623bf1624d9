package com.scanreward.api.platform.validation;

import com.scanreward.api.platform.validation.annotations.HttpUrl;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import lombok.val;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validates a {@link String} type as an HTTP URL. It must have {@code http} or {@code https}
 * scheme, its {@code host} must not be blank and it must not carry a query or a fragment, since
 * token ids are appended to it as a trailing path segment.
 */
public class HttpUrlValidator implements ConstraintValidator<HttpUrl, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }

        try {
            val uri = new URI(value);
            return ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))
                && uri.getHost() != null && !uri.getHost().isBlank()
                && uri.getRawQuery() == null && uri.getRawFragment() == null;
        } catch (URISyntaxException ignored) {
            return false;
        }
    }
}
