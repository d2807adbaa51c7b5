package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;

/**
 * IPv4 CIDR block with an aligned network address.
 */
record Cidr(long network, int prefix) {

    static Cidr parse(String parameter, String text) {
        if (text == null) throw AwsException.MalformedParameter.missing(parameter);
        int slash = text.indexOf('/');
        if (slash < 0) throw invalid(parameter, text);
        String[] octets = text.substring(0, slash).split("\\.", -1);
        if (octets.length != 4) throw invalid(parameter, text);
        long address = 0;
        int prefix;
        try {
            for (String o : octets) {
                if (o.isEmpty() || o.length() > 3) throw invalid(parameter, text);
                int v = Integer.parseInt(o);
                if (v < 0 || v > 255) throw invalid(parameter, text);
                address = (address << 8) | v;
            }
            prefix = Integer.parseInt(text.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw invalid(parameter, text);
        }
        if (prefix < 0 || prefix > 32) throw invalid(parameter, text);
        Cidr cidr = new Cidr(address, prefix);
        if ((address & cidr.mask()) != address) throw invalid(parameter, text);
        return cidr;
    }

    long mask() {
        return prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }

    long size() {
        return 1L << (32 - prefix);
    }

    boolean contains(Cidr other) {
        return other.prefix >= prefix && (other.network & mask()) == network;
    }

    boolean overlaps(Cidr other) {
        return contains(other) || other.contains(this);
    }

    /** Dotted address at {@code offset} from the network address. */
    String address(long offset) {
        return format(network + offset);
    }

    static String format(long address) {
        return ((address >> 24) & 0xFF) + "." + ((address >> 16) & 0xFF) + "." + ((address >> 8) & 0xFF) + "." + (address & 0xFF);
    }

    @Override
    public String toString() {
        return format(network) + "/" + prefix;
    }

    private static AwsException invalid(String parameter, String text) {
        return new AwsException.MalformedParameter("InvalidParameterValue",
                "Value (" + text + ") for parameter " + parameter + " is invalid. This is not a valid CIDR block.");
    }
}
