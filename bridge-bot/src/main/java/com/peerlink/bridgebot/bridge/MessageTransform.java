package com.peerlink.bridgebot.bridge;

import javax.annotation.Nullable;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts message content between platform markup and plain community text.
 */
public final class MessageTransform {
    private MessageTransform() {
    }

    public static final int DISCORD_MAX_LENGTH = 2000;

    private static final Pattern USER_MENTION = Pattern.compile("<@!?(\\d+)>");
    private static final Pattern ROLE_MENTION = Pattern.compile("<@&(\\d+)>");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("<#(\\d+)>");
    private static final Pattern CUSTOM_EMOJI = Pattern.compile("<a?:(\\w+):\\d+>");
    private static final Pattern MASS_MENTION = Pattern.compile("@(everyone|here)");

    /**
     * Platform to community.
     *
     * @return plain text, or an empty string if nothing is left to bridge
     */
    public static String toCommunity(@Nullable String content, SeatResolver seats, ChannelMap channels) {
        if (content == null || content.isBlank()) {
            return "";
        }

        String text = replace(USER_MENTION, content, m -> {
            String name = seats.displayNameOf(m.group(1));
            return "@" + (name != null ? name : "unknown-user");
        });
        text = replace(ROLE_MENTION, text, m -> "@role");
        text = replace(CHANNEL_MENTION, text, m -> {
            String name = channels.getName(m.group(1));
            return "#" + (name != null ? name : "unknown-channel");
        });
        text = replace(CUSTOM_EMOJI, text, m -> ":" + m.group(1) + ":");
        return text.trim();
    }

    /**
     * Community to platform. Mass mentions are broken with a zero-width space so bridged text
     * cannot ping a whole guild.
     *
     * @return platform text, or an empty string if nothing is left to bridge
     */
    public static String toDiscord(@Nullable String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        String text = replace(MASS_MENTION, content.trim(), m -> "@\u200B" + m.group(1));
        if (text.length() > DISCORD_MAX_LENGTH) {
            text = text.substring(0, DISCORD_MAX_LENGTH - 3) + "...";
        }
        return text;
    }

    private static String replace(Pattern pattern, String input, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
