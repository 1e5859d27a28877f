package io.whalewatch.signalbackend.util;

import io.whalewatch.signalbackend.model.ExchangeFlows;
import io.whalewatch.signalbackend.model.MarketOverview;
import io.whalewatch.signalbackend.model.StablecoinFlows;
import io.whalewatch.signalbackend.model.WhaleTransfer;
import java.util.List;

/** Static sample data substituted for any dashboard section that cannot be fetched. */
public final class SampleOverview {
  private SampleOverview() {}

  public static final MarketOverview MARKET =
      new MarketOverview("ETH", 3757.84, -13.22, 104_010_000_000d, 454_450_000_000d);

  public static final ExchangeFlows EXCHANGE_FLOWS =
      new ExchangeFlows(530_276_600d, 663_261_947d, -132_985_346d, "Strong Accumulation (Bullish)");

  public static final StablecoinFlows STABLECOIN =
      new StablecoinFlows(100.0, -20_000_000d, "Risk-Off -> Deploying");

  public static final List<WhaleTransfer> WHALE_TRANSFERS =
      List.of(
          new WhaleTransfer("USDT", "0xc0ba...1a09", "0x28c6...1d60", 1_851_370.43),
          new WhaleTransfer("USDT", "0x17dc...403a", "0xaa8b...3efb", 39_365_167.96));
}
