package io.whalewatch.signalbackend.util;

import java.util.Locale;

public final class UsdFormat {
  private UsdFormat() {}

  public static String usd(Double amount) {
    if (amount == null) return "N/A";
    return "$" + String.format(Locale.US, "%,.2f", amount);
  }

  /** {@code 0x17dc...403a} style abbreviation; short or missing addresses pass through. */
  public static String shortAddress(String address) {
    if (address == null) return "";
    if (address.length() < 10) return address;
    return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
  }
}
