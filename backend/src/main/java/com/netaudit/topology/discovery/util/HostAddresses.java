package com.netaudit.topology.discovery.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class HostAddresses {
  private static final Pattern IPV4 =
      Pattern.compile("^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");
  private static final Pattern IPV6 = Pattern.compile("^[0-9a-f:]+(%[0-9a-z]+)?$");
  private static final Pattern HOSTNAME =
      Pattern.compile("^(?=.{1,253}$)[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?(\\.[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?)*\\.?$");

  private HostAddresses() {}

  public static boolean isIpv4Literal(String value) {
    return value != null && IPV4.matcher(value.trim()).matches();
  }

  public static boolean isIpv6Literal(String value) {
    if (value == null) {
      return false;
    }
    String candidate = value.trim().toLowerCase(Locale.ROOT);
    return candidate.contains(":") && candidate.indexOf("::") == candidate.lastIndexOf("::")
        && IPV6.matcher(candidate).matches();
  }

  public static boolean isAddressLiteral(String value) {
    return isIpv4Literal(value) || isIpv6Literal(value);
  }

  public static boolean isHostname(String value) {
    return value != null && !isAddressLiteral(value)
        && HOSTNAME.matcher(value.trim().toLowerCase(Locale.ROOT)).matches();
  }

  /**
   * Unspecified and loopback addresses that some platforms advertise over CDP.
   */
  public static boolean isUnusable(String address) {
    if (address == null || address.isBlank()) {
      return true;
    }
    String value = address.trim();
    return value.equals("0.0.0.0") || value.startsWith("127.") || value.equals("::") || value.equals("::1");
  }
}
