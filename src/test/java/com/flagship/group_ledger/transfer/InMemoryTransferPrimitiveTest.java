package com.flagship.group_ledger.transfer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransferPrimitiveTest {

    private InMemoryTransferPrimitive primitive;

    @BeforeEach
    void setUp() {
        primitive = new InMemoryTransferPrimitive(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC))
            .openAccount("alice", 100)
            .openAccount("bob", 0);
    }

    @Test
    void testTransferAndCommit_MovesFundsAndRunsCommit() {
        AtomicReference<TransferProof> committed = new AtomicReference<>();

        TransferProof proof = primitive.transferAndCommit(
            new TransferInstruction("k-1", "alice", "bob", 30, "lunch"), committed::set);

        assertSame(proof, committed.get());
        assertEquals("k-1", proof.getTransferKey());
        assertEquals(30, proof.getAmount());
        assertEquals(70, primitive.balanceOf("alice"));
        assertEquals(30, primitive.balanceOf("bob"));
        assertEquals(TransferStatus.CONFIRMED, primitive.lookup("k-1"));
        assertEquals(TransferStatus.NONE, primitive.lookup("k-2"));
    }

    @Test
    void testTransferAndCommit_SameKeyTwiceIsDuplicate() {
        TransferInstruction instruction = new TransferInstruction("k-1", "alice", "bob", 30, null);
        primitive.transferAndCommit(instruction, proof -> { });

        assertThrows(DuplicateTransferException.class, () -> primitive.transferAndCommit(instruction, proof -> { }));
        assertEquals(70, primitive.balanceOf("alice"));
        assertEquals(1, primitive.confirmedCount());
    }

    @Test
    void testTransferAndCommit_FailingCommitUndoesTransfer() {
        TransferInstruction instruction = new TransferInstruction("k-1", "alice", "bob", 30, null);

        assertThrows(IllegalStateException.class, () -> primitive.transferAndCommit(instruction, proof -> {
            throw new IllegalStateException("commit refused");
        }));

        assertEquals(100, primitive.balanceOf("alice"));
        assertEquals(0, primitive.balanceOf("bob"));
        assertEquals(TransferStatus.NONE, primitive.lookup("k-1"));

        primitive.transferAndCommit(instruction, proof -> { });
        assertEquals(70, primitive.balanceOf("alice"));
    }

    @Test
    void testTransferAndCommit_Rejections() {
        assertThrows(TransferRejectedException.class, () -> primitive.transferAndCommit(
            new TransferInstruction("k-1", "alice", "bob", 101, null), proof -> { }));
        assertThrows(TransferRejectedException.class, () -> primitive.transferAndCommit(
            new TransferInstruction("k-2", "carol", "bob", 1, null), proof -> { }));
        assertThrows(TransferRejectedException.class, () -> primitive.transferAndCommit(
            new TransferInstruction("k-3", "alice", "carol", 1, null), proof -> { }));
        assertEquals(100, primitive.balanceOf("alice"));
        assertEquals(0, primitive.confirmedCount());
    }

    @Test
    void testTamperedProofReachesCommit() {
        primitive.tamperWithNextProof(proof -> new TransferProof(proof.getTransferRef(), proof.getTransferKey(),
            proof.getFromMember(), "mallory", proof.getAmount(), proof.getConfirmedAt()));
        AtomicReference<TransferProof> seen = new AtomicReference<>();

        primitive.transferAndCommit(new TransferInstruction("k-1", "alice", "bob", 10, null), seen::set);
        primitive.transferAndCommit(new TransferInstruction("k-2", "alice", "bob", 10, null), seen::set);

        assertEquals("bob", seen.get().getToMember());
        assertEquals(80, primitive.balanceOf("alice"));
    }
}
