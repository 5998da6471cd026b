package com.restschema.server.security;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import com.restschema.errors.ConfigurationException;
import java.net.InetAddress;
import java.util.List;
import java.util.Optional;

/**
 * {@link UserStorage} for {@link AuthMode#X_FORWARDED_FOR}: every client whose address falls
 * into one of the whitelisted ranges is the same fixed user.
 *
 * <p>Ranges are single addresses ({@code 10.0.0.7}, {@code ::1}) or CIDR blocks
 * ({@code 192.168.0.0/16}). The identity is expected to be a client address; anything else
 * is unknown.
 */
public class IpWhitelistStorage implements UserStorage {
  private final ImmutableList<Range> ranges;
  private final User user;

  /**
   * @throws ConfigurationException if a range is not an address or CIDR block
   */
  public IpWhitelistStorage(Iterable<String> ranges, User user) {
    ImmutableList.Builder<Range> parsed = ImmutableList.builder();
    for (String range : ranges) {
      parsed.add(Range.parse(range));
    }
    this.ranges = parsed.build();
    this.user = user;
  }

  @Override
  public Optional<User> getUser(AuthMode identifiedWith, String identity) {
    if (!InetAddresses.isInetAddress(identity)) {
      return Optional.empty();
    }
    byte[] address = InetAddresses.forString(identity).getAddress();
    for (Range range : ranges) {
      if (range.contains(address)) {
        return Optional.of(user);
      }
    }
    return Optional.empty();
  }

  private record Range(byte[] network, int prefixLength) {

    static Range parse(String text) {
      List<String> parts = Splitter.on('/').trimResults().splitToList(text);
      if (parts.size() > 2 || !InetAddresses.isInetAddress(parts.get(0))) {
        throw new ConfigurationException("not an IP address or CIDR block: " + text);
      }
      InetAddress address = InetAddresses.forString(parts.get(0));
      int bits = address.getAddress().length * 8;
      int prefixLength = bits;
      if (parts.size() == 2) {
        try {
          prefixLength = Integer.parseInt(parts.get(1));
        } catch (NumberFormatException e) {
          throw new ConfigurationException("invalid prefix length in " + text, e);
        }
        if (prefixLength < 0 || prefixLength > bits) {
          throw new ConfigurationException("invalid prefix length in " + text);
        }
      }
      return new Range(address.getAddress(), prefixLength);
    }

    boolean contains(byte[] address) {
      if (address.length != network.length) {
        return false;
      }
      int fullBytes = prefixLength / 8;
      for (int i = 0; i < fullBytes; i++) {
        if (address[i] != network[i]) {
          return false;
        }
      }
      int remainingBits = prefixLength % 8;
      if (remainingBits == 0) {
        return true;
      }
      int mask = (0xFF << (8 - remainingBits)) & 0xFF;
      return (address[fullBytes] & mask) == (network[fullBytes] & mask);
    }
  }
}
