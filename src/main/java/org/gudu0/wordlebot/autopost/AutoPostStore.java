package org.gudu0.wordlebot.autopost;

import org.gudu0.wordlebot.util.JsonStore;

import java.nio.file.Path;
import java.time.LocalDate;

public class AutoPostStore {
    private final JsonStore<AutoPostState> store;

    public AutoPostStore(Path path) {
        this.store = new JsonStore<>(path, AutoPostState.class, AutoPostState::new, "autopost.json");
    }

    public AutoPostState state() { return store.get(); }

    public boolean postedOn(LocalDate day) {
        synchronized (store.lock) {
            return day.toString().equals(store.get().lastPostedDate);
        }
    }

    public void recordPost(LocalDate day, long channelId, long messageId) {
        store.update(st -> {
            st.lastPostedDate = day.toString();
            st.lastChannelId = Long.toString(channelId);
            st.lastMessageId = messageId;
        });
        store.tryFlush();
    }
}
