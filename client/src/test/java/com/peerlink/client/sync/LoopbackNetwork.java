package com.peerlink.client.sync;

import com.peerlink.client.relay.ConnectionState;
import com.peerlink.client.relay.IRelayConnection;
import com.peerlink.client.relay.RelayListener;
import com.peerlink.core.event.CommunityEventEnvelope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Relay stand-in connecting peers in one JVM. Sends to an offline DID are queued and delivered
 * when that DID comes online, like the relay's offline queue.
 */
class LoopbackNetwork {
    private final Map<String, List<RelayListener>> online = new HashMap<>();
    private final Map<String, List<String[]>> queued = new HashMap<>();
    final List<String> sentPayloads = new ArrayList<>();

    Connection connectionFor(String did) {
        return new Connection(did);
    }

    void goOnline(String did, RelayListener listener) {
        online.computeIfAbsent(did, k -> new ArrayList<>()).add(listener);
        for (String[] pending : queued.getOrDefault(did, List.of())) {
            deliver(did, pending[0], pending[1]);
        }
        queued.remove(did);
    }

    void goOffline(String did) {
        online.remove(did);
    }

    int queuedFor(String did) {
        return queued.getOrDefault(did, List.of()).size();
    }

    private void deliver(String toDid, String fromDid, String payload) {
        for (RelayListener listener : online.get(toDid)) {
            listener.onRawMessage(fromDid, payload);
            CommunityEventEnvelope.tryParse(payload).ifPresent(envelope -> listener.onEnvelope(envelope, fromDid));
        }
    }

    class Connection implements IRelayConnection {
        private final String did;
        private boolean connected = true;

        Connection(String did) {
            this.did = did;
        }

        void setConnected(boolean connected) {
            this.connected = connected;
        }

        @Override
        public void connect() {
            connected = true;
        }

        @Override
        public void disconnect() {
            connected = false;
        }

        @Override
        public boolean sendToDid(String toDid, String payload) {
            if (!connected) {
                return false;
            }
            sentPayloads.add(payload);
            if (online.containsKey(toDid)) {
                deliver(toDid, did, payload);
            } else {
                queued.computeIfAbsent(toDid, k -> new ArrayList<>()).add(new String[]{did, payload});
            }
            return true;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public ConnectionState getState() {
            return connected ? ConnectionState.REGISTERED : ConnectionState.DISCONNECTED;
        }

        @Override
        public void addListener(RelayListener listener) {
            goOnline(did, listener);
        }
    }
}
