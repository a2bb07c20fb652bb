package com.consullo.daemon.node;

import java.nio.file.Path;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Credentials for a node's JSON-RPC interface: either a cookie file or a user/password pair.
 *
 * @since 1.0
 */
public final class RpcAuth {

  public enum Type {
    COOKIE_FILE,
    USER_PASS
  }

  private final Type type;
  private final Path cookieFile;
  private final String user;
  private final String password;

  private RpcAuth(final Type type, final Path cookieFile, final String user, final String password) {
    this.type = type;
    this.cookieFile = cookieFile;
    this.user = user;
    this.password = password;
  }

  public static RpcAuth cookieFile(final Path cookieFile) {
    Validate.notNull(cookieFile, "cookieFile must not be null");
    return new RpcAuth(Type.COOKIE_FILE, cookieFile, null, null);
  }

  public static RpcAuth userPass(final String user, final String password) {
    Validate.notNull(user, "user must not be null");
    Validate.notNull(password, "password must not be null");
    return new RpcAuth(Type.USER_PASS, null, user, password);
  }

  public Type type() {
    return type;
  }

  /**
   * @return cookie file path, null for user/password auth
   */
  public Path cookieFile() {
    return cookieFile;
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RpcAuth)) {
      return false;
    }
    final RpcAuth other = (RpcAuth) o;
    return type == other.type
        && Objects.equals(cookieFile, other.cookieFile)
        && Objects.equals(user, other.user)
        && Objects.equals(password, other.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, cookieFile, user, password);
  }

  @Override
  public String toString() {
    if (type == Type.COOKIE_FILE) {
      return "CookieFile(" + cookieFile + ")";
    }
    return "UserPass(" + user + ", ***)";
  }
}
