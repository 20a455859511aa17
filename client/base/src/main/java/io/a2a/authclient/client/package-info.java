/**
 * The authenticated A2A client and its configuration.
 */
@NullMarked
package io.a2a.authclient.client;

import org.jspecify.annotations.NullMarked;
