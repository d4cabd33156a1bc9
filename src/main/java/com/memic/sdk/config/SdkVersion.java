package com.memic.sdk.config;

/**
 * Version of this SDK as recorded in the jar manifest, used in the {@code User-Agent} header.
 */
final class SdkVersion {

    private static final String UNKNOWN = "dev";

    private SdkVersion() {
    }

    static String get() {
        String version = SdkVersion.class.getPackage().getImplementationVersion();
        return version != null ? version : UNKNOWN;
    }
}
