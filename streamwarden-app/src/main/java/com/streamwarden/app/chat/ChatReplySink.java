package com.streamwarden.app.chat;

import com.streamwarden.app.commands.CommandResult;

/**
 * Where command replies go.
 */
public interface ChatReplySink {

    void send(String channelId, CommandResult reply);
}
