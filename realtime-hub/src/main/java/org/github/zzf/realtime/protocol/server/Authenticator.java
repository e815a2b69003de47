package org.github.zzf.realtime.protocol.server;

/**
 * token validity decision, issued somewhere else.
 */
@FunctionalInterface
public interface Authenticator {

    boolean authenticate(String token);

}
