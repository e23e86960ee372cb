package com.cloudant.handoff;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ChangeChannelTest {

    @Test
    public void offerDropsWhenFull() {
        final ChangeChannel channel = new ChangeChannel(2);
        assertTrue(channel.offer(ChangeType.ADD));
        assertTrue(channel.offer(ChangeType.ADD));
        assertFalse(channel.offer(ChangeType.ADD));
        assertFalse(channel.offer(ChangeType.REMOVE));
        assertThat(channel.size(), is(2));
    }

    @Test
    public void addReplacesOldestRemoveWhenFull() throws Exception {
        final ChangeChannel channel = new ChangeChannel(2);
        channel.offer(ChangeType.REMOVE);
        channel.offer(ChangeType.ADD);
        assertTrue(channel.offer(ChangeType.ADD));

        final CancellationSignal signal = new CancellationSignal();
        assertThat(channel.receive(signal), is(ChangeType.ADD));
        assertThat(channel.receive(signal), is(ChangeType.ADD));
        assertThat(channel.size(), is(0));
    }

    @Test
    public void receiveIsFifo() throws Exception {
        final ChangeChannel channel = new ChangeChannel(3);
        channel.offer(ChangeType.REMOVE);
        channel.offer(ChangeType.ADD);
        final CancellationSignal signal = new CancellationSignal();
        assertThat(channel.receive(signal), is(ChangeType.REMOVE));
        assertThat(channel.receive(signal), is(ChangeType.ADD));
    }

    @Test
    public void discardPendingEmptiesChannel() {
        final ChangeChannel channel = new ChangeChannel(4);
        channel.offer(ChangeType.ADD);
        channel.offer(ChangeType.REMOVE);
        assertThat(channel.discardPending(), is(2));
        assertThat(channel.size(), is(0));
    }

    @Test
    public void cancelledSignalWinsOverPendingEvent() throws Exception {
        final ChangeChannel channel = new ChangeChannel(1);
        channel.offer(ChangeType.ADD);
        final CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        assertThat(channel.receive(signal), is(nullValue()));
        assertThat(channel.size(), is(1));
    }

    @Test
    public void closedChannelRefusesEventsAndReleasesReceivers() throws Exception {
        final ChangeChannel channel = new ChangeChannel(1);
        channel.offer(ChangeType.ADD);
        channel.close();
        assertTrue(channel.isClosed());
        assertThat(channel.size(), is(0));
        assertFalse(channel.offer(ChangeType.ADD));
        assertThat(channel.receive(new CancellationSignal()), is(nullValue()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void capacityMustBePositive() {
        new ChangeChannel(0);
    }

}
