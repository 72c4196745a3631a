package com.stylus.stream.broker.utils;

import com.stylus.stream.broker.model.ResourceKind;

import javax.annotation.Nullable;
import java.util.regex.Pattern;

public class ChannelKeys {
    // virtual channel as the tuner sees it: "7", "10.1"
    private static final Pattern TUNER_CHANNEL = Pattern.compile("^\\d{1,4}(\\.\\d{1,4})?$");
    // xtream-codes stream id
    private static final Pattern PROVIDER_STREAM = Pattern.compile("^\\d{1,12}$");

    public static boolean isValid(@Nullable String channelKey, @Nullable ResourceKind resourceKind) {
        if (channelKey == null || resourceKind == null) {
            return false;
        }
        switch (resourceKind) {
            case TUNER:
                return TUNER_CHANNEL.matcher(channelKey).matches();
            case CREDENTIAL:
                return PROVIDER_STREAM.matcher(channelKey).matches();
            default:
                return false;
        }
    }
}
