package com.techlab.mailmerge.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Optional per-request assets. Logo and signature are data-URI strings; they are embedded by the
 * renderer through the reserved {{logo}}, {{signature}} and {{service_name}} placeholders.
 */
@Value
@Builder
public class Assets {

    public static final String LOGO = "logo";
    public static final String SIGNATURE = "signature";
    public static final String SERVICE_NAME = "service_name";

    /** Placeholder names filled from the assets, never from row data. */
    public static final Set<String> RESERVED_PLACEHOLDERS = Set.of(LOGO, SIGNATURE, SERVICE_NAME);

    public static final Assets NONE = Assets.builder().build();

    String logo;
    String signature;
    String serviceName;

    public boolean hasLogo() {
        return logo != null && !logo.isBlank();
    }

    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }

    public boolean hasServiceName() {
        return serviceName != null && !serviceName.isBlank();
    }
}
