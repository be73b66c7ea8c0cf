package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.GitProviderAdapter;
import com.quashbugs.prpulse.adapter.MessagingProviderAdapter;
import com.quashbugs.prpulse.exception.UnsupportedProviderException;
import com.quashbugs.prpulse.model.GitProviderType;
import com.quashbugs.prpulse.model.MessagingProviderType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the capability implementation for a persisted provider type. Provider types without an
 * implementation (Bitbucket, Teams) resolve to {@link UnsupportedProviderException}.
 */
@Service
public class ProviderRegistryService {

    private final Map<GitProviderType, GitProviderAdapter> gitAdapters = new EnumMap<>(GitProviderType.class);
    private final Map<MessagingProviderType, MessagingProviderAdapter> messagingAdapters = new EnumMap<>(MessagingProviderType.class);

    @Autowired
    public ProviderRegistryService(List<GitProviderAdapter> gitAdapters,
                                   List<MessagingProviderAdapter> messagingAdapters) {
        gitAdapters.forEach(adapter -> this.gitAdapters.put(adapter.getProviderType(), adapter));
        messagingAdapters.forEach(adapter -> this.messagingAdapters.put(adapter.getProviderType(), adapter));
    }

    public GitProviderAdapter getGitProvider(GitProviderType type) {
        GitProviderAdapter adapter = type != null ? gitAdapters.get(type) : null;
        if (adapter == null) {
            throw new UnsupportedProviderException("Unsupported git provider: " + type);
        }
        return adapter;
    }

    public MessagingProviderAdapter getMessagingProvider(MessagingProviderType type) {
        MessagingProviderAdapter adapter = type != null ? messagingAdapters.get(type) : null;
        if (adapter == null) {
            throw new UnsupportedProviderException("Unsupported messaging provider: " + type);
        }
        return adapter;
    }
}
