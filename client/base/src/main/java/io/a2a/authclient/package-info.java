@NullMarked
package io.a2a.authclient;

import org.jspecify.annotations.NullMarked;
