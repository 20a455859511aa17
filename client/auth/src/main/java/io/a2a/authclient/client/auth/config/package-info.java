/**
 * Declarative authentication settings, one record per supported scheme.
 */
@NullMarked
package io.a2a.authclient.client.auth.config;

import org.jspecify.annotations.NullMarked;
