package com.codeheadsystems.tessera.server.manager;

/**
 * Client device details captured at login and on later requests.
 *
 * @param ipAddress client address, may be null
 * @param userAgent client user agent, may be null
 */
public record DeviceMetadata(String ipAddress, String userAgent) {
}
