package com.tictactoe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tictactoe.connection.ConnectionSupervisor;
import com.tictactoe.game.GameSession;
import com.tictactoe.game.GameStatus;
import com.tictactoe.game.JoinResult;
import com.tictactoe.game.Mark;
import com.tictactoe.game.MoveResult;
import com.tictactoe.game.Rejection;
import com.tictactoe.game.TurnEngine;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.state.BroadcastHub;
import com.tictactoe.state.SessionRegistry;
import org.junit.jupiter.api.*;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for binding connections to seats:
 * - Join replies and broadcasts
 * - Reconnection by name, including reconnect/disconnect races
 * - Rejections and errors reach only the originator
 */
@DisplayName("Connection Supervisor Tests")
class ConnectionSupervisorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SessionRegistry registry;
    private TurnEngine engine;
    private MessageSerializer serializer;
    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new TestClock());
        engine = new TurnEngine();
        serializer = new MessageSerializer();
        hub = new BroadcastHub(serializer);
    }

    private ConnectionSupervisor supervise(TestConnection connection) {
        return new ConnectionSupervisor(connection, registry, engine, hub, serializer);
    }

    // Round-trips through text so numeric nodes compare like the ones received
    private JsonNode currentState(String sessionId) throws Exception {
        GameSession session = registry.get(sessionId);
        return objectMapper.readTree(objectMapper.writeValueAsString(session.withLock(session::snapshot)));
    }

    // ==========================================
    // Test: Join
    // ==========================================

    @Test
    @DisplayName("Joining replies JOINED to the joiner and STATE to everyone seated")
    void testJoinRepliesAndBroadcasts() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        ConnectionSupervisor bob = supervise(bobConn);

        alice.bind("abc", "Alice");
        JsonNode joined = aliceConn.last("JOINED");
        assertNotNull(joined);
        assertEquals("X", joined.get("payload").get("role").asText());
        assertFalse(joined.get("payload").get("reconnected").asBoolean());
        assertEquals("WAITING_FOR_PLAYERS", aliceConn.lastState().get("status").asText());

        bob.bind("abc", "Bob");
        assertEquals("O", bobConn.last("JOINED").get("payload").get("role").asText());
        assertEquals(1, aliceConn.messages("JOINED").size(), "JOINED goes to the joiner only");

        JsonNode aliceView = aliceConn.lastState();
        JsonNode bobView = bobConn.lastState();
        assertEquals(aliceView, bobView, "Both players see the same snapshot");
        assertEquals("IN_PROGRESS", aliceView.get("status").asText());
        assertEquals("X", aliceView.get("turn").asText());
        assertEquals("Bob", aliceView.get("players").get("O").get("name").asText());
        assertTrue(aliceView.get("players").get("O").get("connected").asBoolean());
    }

    @Test
    @DisplayName("JOINED arrives before the STATE it belongs to")
    void testJoinedPrecedesState() {
        TestConnection conn = new TestConnection();
        supervise(conn).bind("order", "Alice");

        JsonNode first = TestConnection.parse(conn.getSent().get(0));
        JsonNode second = TestConnection.parse(conn.getSent().get(1));
        assertEquals("JOINED", first.get("type").asText());
        assertEquals("STATE", second.get("type").asText());
    }

    @Test
    @DisplayName("A third player gets REJECTED and nobody else hears about it")
    void testSessionFullGoesToOriginatorOnly() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        TestConnection carolConn = new TestConnection();
        supervise(aliceConn).bind("full", "Alice");
        supervise(bobConn).bind("full", "Bob");
        aliceConn.clear();
        bobConn.clear();

        JoinResult result = supervise(carolConn).bind("full", "Carol");

        assertEquals(Rejection.SESSION_FULL, result.getRejection());
        assertEquals("SESSION_FULL", carolConn.last("REJECTED").get("payload").get("reason").asText());
        assertTrue(carolConn.messages("STATE").isEmpty());
        assertTrue(aliceConn.getSent().isEmpty());
        assertTrue(bobConn.getSent().isEmpty());
    }

    // ==========================================
    // Test: Moves
    // ==========================================

    @Test
    @DisplayName("Out-of-turn moves are rejected to the mover only")
    void testRejectionGoesToOriginatorOnly() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        supervise(aliceConn).bind("turns", "Alice");
        ConnectionSupervisor bob = supervise(bobConn);
        bob.bind("turns", "Bob");
        aliceConn.clear();
        bobConn.clear();

        MoveResult result = bob.move(4);

        assertEquals(Rejection.NOT_YOUR_TURN, result.getRejection());
        assertEquals("NOT_YOUR_TURN", bobConn.last("REJECTED").get("payload").get("reason").asText());
        assertTrue(aliceConn.getSent().isEmpty(), "The opponent hears nothing about a rejection");
    }

    @Test
    @DisplayName("Accepted moves are broadcast to both players")
    void testAcceptedMoveBroadcast() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        alice.bind("moves", "Alice");
        supervise(bobConn).bind("moves", "Bob");

        assertTrue(alice.move(4).isAccepted());

        assertEquals("X", bobConn.lastState().get("board").get(4).asText());
        assertEquals("O", bobConn.lastState().get("turn").asText());
        assertEquals(aliceConn.lastState(), bobConn.lastState());
    }

    @Test
    @DisplayName("Moves from a connection without a seat get an ERROR")
    void testMoveWithoutSeat() {
        TestConnection conn = new TestConnection();
        ConnectionSupervisor supervisor = supervise(conn);

        assertNull(supervisor.move(0));
        assertNull(supervisor.reset());
        assertFalse(supervisor.leave());

        assertEquals(3, conn.messages("ERROR").size());
        assertEquals("Not in a session", conn.last("ERROR").get("payload").get("message").asText());
    }

    // ==========================================
    // Test: Reconnection
    // ==========================================

    @Test
    @DisplayName("Rejoining by name returns the same role and the match as it stands")
    void testReconnectResumesMatch() throws Exception {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        ConnectionSupervisor bob = supervise(bobConn);
        alice.bind("resume", "Alice");
        bob.bind("resume", "Bob");
        alice.move(0);
        bob.move(4);

        assertTrue(alice.unbind());
        aliceConn.drop();
        JsonNode bobView = bobConn.lastState();
        assertFalse(bobView.get("players").get("X").get("connected").asBoolean(),
                "Opponent sees the player as disconnected");
        assertEquals("IN_PROGRESS", bobView.get("status").asText(), "Disconnect is not an error");

        // Bob cannot play Alice's turn for her
        assertEquals(Rejection.NOT_YOUR_TURN, bob.move(8).getRejection());

        TestConnection aliceConn2 = new TestConnection();
        ConnectionSupervisor aliceAgain = supervise(aliceConn2);
        JoinResult rejoin = aliceAgain.bind("resume", "Alice");

        assertTrue(rejoin.isReconnected());
        assertEquals(Mark.X, rejoin.getRole());
        assertTrue(aliceConn2.last("JOINED").get("payload").get("reconnected").asBoolean());

        JsonNode resumed = aliceConn2.lastState();
        assertEquals(currentState("resume"), resumed);
        assertEquals("X", resumed.get("board").get(0).asText());
        assertEquals("O", resumed.get("board").get(4).asText());
        assertEquals("X", resumed.get("turn").asText());
        assertTrue(resumed.get("players").get("X").get("connected").asBoolean());
    }

    @Test
    @DisplayName("Moves made while a player is away are part of the resumed state")
    void testMovesWhileDisconnected() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        ConnectionSupervisor bob = supervise(bobConn);
        alice.bind("away", "Alice");
        bob.bind("away", "Bob");
        alice.move(0);

        bob.unbind();
        bobConn.drop();
        // Alice cannot move twice, so the game waits for Bob
        assertEquals(Rejection.NOT_YOUR_TURN, alice.move(1).getRejection());

        ConnectionSupervisor bobAgain = supervise(new TestConnection());
        assertEquals(Mark.O, bobAgain.bind("away", "Bob").getRole());
        assertTrue(bobAgain.move(8).isAccepted());

        alice.unbind();
        aliceConn.drop();
        assertEquals(GameStatus.IN_PROGRESS, bobAgain.reset());

        TestConnection aliceConn2 = new TestConnection();
        supervise(aliceConn2).bind("away", "Alice");
        JsonNode state = aliceConn2.lastState();
        for (JsonNode cell : state.get("board")) {
            assertEquals("EMPTY", cell.asText(), "Reset made while away is visible on return");
        }
    }

    @Test
    @DisplayName("A stale disconnect never clears a newer reconnection")
    void testStaleUnbindDoesNotClobberReconnect() {
        TestConnection oldConn = new TestConnection();
        ConnectionSupervisor oldSupervisor = supervise(oldConn);
        oldSupervisor.bind("race", "Alice");
        supervise(new TestConnection()).bind("race", "Bob");

        // Transport notices the drop, but cleanup has not run yet
        oldConn.drop();
        TestConnection newConn = new TestConnection();
        ConnectionSupervisor newSupervisor = supervise(newConn);
        assertTrue(newSupervisor.bind("race", "Alice").isReconnected());

        // Cleanup of the old connection finally runs
        assertFalse(oldSupervisor.unbind(), "Old connection no longer owns the seat");

        GameSession session = registry.get("race");
        assertTrue(session.withLock(() -> session.getSlot(Mark.X).orElseThrow().isHeldBy(newConn)));
        assertTrue(newConn.lastState().get("players").get("X").get("connected").asBoolean());
        assertTrue(newSupervisor.move(0).isAccepted());
    }

    @Test
    @DisplayName("A name still connected elsewhere is refused")
    void testNameInUse() {
        supervise(new TestConnection()).bind("dup", "Alice");
        TestConnection second = new TestConnection();

        JoinResult result = supervise(second).bind("dup", "Alice");

        assertEquals(Rejection.NAME_IN_USE, result.getRejection());
        assertEquals("NAME_IN_USE", second.last("REJECTED").get("payload").get("reason").asText());
    }

    @Test
    @DisplayName("Unbinding twice is harmless")
    void testUnbindIdempotent() {
        ConnectionSupervisor alice = supervise(new TestConnection());
        alice.bind("twice", "Alice");

        assertTrue(alice.unbind());
        assertFalse(alice.unbind());
        assertFalse(alice.isBound());
    }

    @Test
    @DisplayName("Joining another session gives up the current seat")
    void testRebindMovesSeat() {
        TestConnection conn = new TestConnection();
        ConnectionSupervisor supervisor = supervise(conn);
        supervisor.bind("first", "Alice");

        supervisor.bind("second", "Alice");

        assertEquals("second", supervisor.getSessionId());
        GameSession first = registry.get("first");
        assertFalse(first.withLock(() -> first.getSlot(Mark.X).orElseThrow().isConnected()));
    }

    @Test
    @DisplayName("A refused JOIN from a seated connection keeps its seat untouched")
    void testRejectedRebindKeepsSeat() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        alice.bind("abc", "Alice");
        supervise(bobConn).bind("abc", "Bob");
        GameSession session = registry.get("abc");
        long version = session.withLock(session::getVersion);
        aliceConn.clear();
        bobConn.clear();

        JoinResult full = alice.bind("abc", "Carol");
        JoinResult taken = alice.bind("abc", "Bob");

        assertEquals(Rejection.SESSION_FULL, full.getRejection());
        assertEquals(Rejection.NAME_IN_USE, taken.getRejection());
        assertEquals(2, aliceConn.messages("REJECTED").size());
        assertTrue(aliceConn.messages("STATE").isEmpty());
        assertTrue(bobConn.getSent().isEmpty(), "Opponent hears nothing");

        assertTrue(alice.isBound());
        assertEquals("abc", alice.getSessionId());
        assertEquals(Mark.X, alice.getRole());
        assertTrue(session.withLock(() -> session.getSlot(Mark.X).orElseThrow().isConnected()));
        assertEquals(version, session.withLock(session::getVersion));
        assertTrue(alice.move(0).isAccepted(), "Still plays as X");
    }

    @Test
    @DisplayName("A refused JOIN into another session keeps the current seat")
    void testRejectedCrossSessionRebindKeepsSeat() {
        ConnectionSupervisor alice = supervise(new TestConnection());
        alice.bind("home", "Alice");
        supervise(new TestConnection()).bind("away", "Bob");
        supervise(new TestConnection()).bind("away", "Carol");

        JoinResult result = alice.bind("away", "Alice");

        assertEquals(Rejection.SESSION_FULL, result.getRejection());
        assertEquals("home", alice.getSessionId());
        GameSession home = registry.get("home");
        assertTrue(home.withLock(() -> home.getSlot(Mark.X).orElseThrow().isConnected()));
    }

    @Test
    @DisplayName("Repeating the JOIN for the seat already held changes nothing")
    void testRepeatedJoinIsIdempotent() {
        TestConnection aliceConn = new TestConnection();
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor alice = supervise(aliceConn);
        alice.bind("same", "Alice");
        supervise(bobConn).bind("same", "Bob");
        GameSession session = registry.get("same");
        long version = session.withLock(session::getVersion);
        aliceConn.clear();
        bobConn.clear();

        JoinResult result = alice.bind("same", "Alice");

        assertTrue(result.isReconnected());
        assertEquals(Mark.X, result.getRole());
        assertEquals("X", aliceConn.last("JOINED").get("payload").get("role").asText());
        assertNotNull(aliceConn.lastState());
        assertTrue(bobConn.getSent().isEmpty());
        assertEquals(version, session.withLock(session::getVersion));
    }

    // ==========================================
    // Test: Leave
    // ==========================================

    @Test
    @DisplayName("Leaving lets a different player take the seat")
    void testLeave() {
        ConnectionSupervisor alice = supervise(new TestConnection());
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor bob = supervise(bobConn);
        alice.bind("leave", "Alice");
        bob.bind("leave", "Bob");

        assertTrue(bob.leave());
        assertFalse(bob.isBound());
        assertFalse(aliceHasOpponent("leave"));

        JoinResult carol = supervise(new TestConnection()).bind("leave", "Carol");
        assertEquals(Mark.O, carol.getRole());
        assertFalse(carol.isReconnected());
    }

    @Test
    @DisplayName("Leaving a seat that was already dropped gets an ERROR")
    void testLeaveAfterDrop() {
        ConnectionSupervisor alice = supervise(new TestConnection());
        TestConnection bobConn = new TestConnection();
        ConnectionSupervisor bob = supervise(bobConn);
        alice.bind("dropped", "Alice");
        bob.bind("dropped", "Bob");
        GameSession session = registry.get("dropped");
        // What the hub does to a slow consumer
        session.runLocked(() -> session.detach(Mark.O, bobConn));
        bobConn.clear();

        assertFalse(bob.leave());

        assertEquals("Not in a session", bobConn.last("ERROR").get("payload").get("message").asText());
        assertFalse(bob.isBound());
        assertTrue(aliceHasOpponent("dropped"), "The seat stays reserved for Bob");
    }

    private boolean aliceHasOpponent(String sessionId) {
        GameSession session = registry.get(sessionId);
        return session.withLock(() -> session.getSlot(Mark.O).isPresent());
    }

    // ==========================================
    // Test: Eviction race
    // ==========================================

    @Test
    @DisplayName("A join that loses the race with eviction lands in a fresh session")
    void testJoinRetriesAfterEviction() throws Exception {
        GameSession doomed = registry.getOrCreate("evicted");
        AtomicReference<JoinResult> result = new AtomicReference<>();
        Thread joiner = new Thread(() -> result.set(supervise(new TestConnection()).bind("evicted", "Alice")));

        doomed.runLocked(() -> {
            joiner.start();
            // Wait until the joiner is parked on this session's lock
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (joiner.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            doomed.markRemoved();
            registry.remove("evicted", doomed);
        });

        joiner.join(5000);
        assertNotNull(result.get(), "Join should complete");
        assertTrue(result.get().isAccepted());

        GameSession fresh = registry.get("evicted");
        assertNotNull(fresh);
        assertNotSame(doomed, fresh);
        assertTrue(fresh.withLock(() -> fresh.getSlot(Mark.X).isPresent()));
        assertTrue(doomed.withLock(() -> doomed.getSlots().isEmpty()), "Evicted session stays untouched");
        assertEquals(GameStatus.WAITING_FOR_PLAYERS, fresh.withLock(fresh::getStatus));
    }
}
