package cafe.woden.ircbot.net;

import java.net.InetSocketAddress;
import org.jmolecules.ddd.annotation.ValueObject;

/** A {@code host:port} pair; IPv6 literals are written in brackets ({@code [::1]:6697}). */
@ValueObject
public record ServerAddress(String host, int port) {
  public ServerAddress {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host is blank");
    if (port <= 0 || port > 65535) throw new IllegalArgumentException("invalid port: " + port);
    host = host.trim();
  }

  public static ServerAddress parse(String address) {
    String s = address == null ? "" : address.trim();
    int colon = s.lastIndexOf(':');
    if (colon <= 0 || colon == s.length() - 1) {
      throw new IllegalArgumentException("expected host:port but got '" + s + "'");
    }
    String host = s.substring(0, colon);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    }
    int port;
    try {
      port = Integer.parseInt(s.substring(colon + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port in '" + s + "'", e);
    }
    return new ServerAddress(host, port);
  }

  public InetSocketAddress toSocketAddress() {
    return new InetSocketAddress(host, port);
  }

  @Override
  public String toString() {
    return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
  }
}
