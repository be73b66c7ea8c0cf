package com.quashbugs.prpulse.adapter;

import com.quashbugs.prpulse.dto.MessageStyle;
import com.quashbugs.prpulse.dto.RenderedMessageDTO;
import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.model.MessagingProvider;
import com.quashbugs.prpulse.model.MessagingProviderType;

import java.util.Optional;

public interface MessagingProviderAdapter {

    MessagingProviderType getProviderType();

    MessageStyle getMessageStyle();

    void sendMessage(MessagingProvider connection, String channelId, RenderedMessageDTO message);

    Optional<TokenRefreshDTO> refreshToken(MessagingProvider connection);
}
