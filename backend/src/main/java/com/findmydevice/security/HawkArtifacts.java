package com.findmydevice.security;

/**
 * Everything that goes into one Hawk MAC. Built once per request, never mutated.
 */
public record HawkArtifacts(String ts,
                            String nonce,
                            String method,
                            String path,
                            String host,
                            String port,
                            String hash,
                            String ext) {
}
