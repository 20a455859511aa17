@NullMarked
package io.a2a.authclient.client.transport.spi;

import org.jspecify.annotations.NullMarked;
