package com.example.profilestore.profile;

import com.example.profilestore.store.RemoteStore;
import com.example.profilestore.store.StoreRetrier;

import java.util.List;
import java.util.Optional;

/**
 * Append-only ordered index of version ids for one owner. The greatest id is "latest".
 */
public class VersionLedger {

    private final RemoteStore remote;
    private final StoreRetrier retrier;
    private final String documentsName;
    private final String ledgerName;

    public VersionLedger(RemoteStore remote, StoreRetrier retrier, String storeName, String storeVersion, String ownerId) {
        this.remote = remote;
        this.retrier = retrier;
        this.documentsName = storeName + ":" + storeVersion + ":" + ownerId;
        this.ledgerName = documentsName + ":versions";
    }

    /** Store name under which this owner's documents are keyed by version id. */
    public String documentsName() {
        return documentsName;
    }

    public String ledgerName() {
        return ledgerName;
    }

    public Optional<Long> latestVersion() {
        List<Long> latest = recentVersions(1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    /**
     * Newest-first version ids, at most {@code limit}.
     */
    public List<Long> recentVersions(int limit) {
        List<String> keys = retrier.call("listSorted " + ledgerName,
                () -> remote.listSorted(ledgerName, true, limit));
        return keys.stream().map(this::parse).toList();
    }

    public void append(long version) {
        retrier.run("append " + ledgerName, () -> remote.putOrdered(ledgerName, Long.toString(version), version));
    }

    private long parse(String key) {
        try {
            return Long.parseLong(key);
        } catch (NumberFormatException e) {
            throw new ProfileDecodeException("Ledger " + ledgerName + " holds a non-numeric version id: " + key, e);
        }
    }
}
