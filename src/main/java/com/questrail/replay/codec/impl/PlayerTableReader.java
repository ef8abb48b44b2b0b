package com.questrail.replay.codec.impl;

import com.questrail.replay.codec.ByteCursor;
import com.questrail.replay.codec.ReplayText;
import com.questrail.replay.model.ParticipantKind;
import com.questrail.replay.model.PlayerRecord;
import com.questrail.replay.model.Race;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads a player slot table at a given base offset and slot size.
 *
 * <p>A slot is kept only if it is in bounds, its name passes
 * {@link TextHeuristics#isPlausiblePlayerName(byte[])}, its race code is
 * defined and its kind is not empty. The slot index of a record is its
 * position in the table.</p>
 */
final class PlayerTableReader
{
    private final ByteCursor body;

    PlayerTableReader(ByteCursor body)
    {
        this.body = body;
    }

    /**
     * Reads the table as the known-offset tiers do: any subset of valid slots.
     */
    List<PlayerRecord> read(int base, int slotSize)
    {
        final List<PlayerRecord> players = new ArrayList<>();
        for (int slot = 0; slot < HeaderLayout.SLOT_COUNT; slot++) {
            readSlot(base + slot * slotSize, slotSize, slot).ifPresent(players::add);
        }
        return players;
    }

    /**
     * Reads the table as the scan tier does: slot 0 has to be valid, otherwise
     * the base is rejected outright.
     */
    List<PlayerRecord> readAnchored(int base, int slotSize)
    {
        if (readSlot(base, slotSize, 0).isEmpty()) {
            return List.of();
        }
        return read(base, slotSize);
    }

    Optional<PlayerRecord> readSlot(int offset, int slotSize, int slot)
    {
        final int nameLength = Math.min(HeaderLayout.SLOT_NAME_LENGTH, slotSize - HeaderLayout.SLOT_NAME);
        if (nameLength <= 0) {
            return Optional.empty();
        }

        final OptionalInt kindCode = body.u8At(offset + HeaderLayout.SLOT_KIND);
        final OptionalInt raceCode = body.u8At(offset + HeaderLayout.SLOT_RACE);
        final OptionalInt team = body.u8At(offset + HeaderLayout.SLOT_TEAM);
        final OptionalInt color = body.u8At(offset + HeaderLayout.SLOT_COLOR);
        final Optional<byte[]> nameBytes = body.bytesAt(offset + HeaderLayout.SLOT_NAME, nameLength);

        if (kindCode.isEmpty() || raceCode.isEmpty() || team.isEmpty() || color.isEmpty() || nameBytes.isEmpty()) {
            return Optional.empty();
        }

        final ParticipantKind kind = ParticipantKind.fromCode(kindCode.getAsInt());
        if (kind == ParticipantKind.EMPTY || !Race.isValidCode(raceCode.getAsInt())) {
            return Optional.empty();
        }

        final byte[] name = ReplayText.truncateAtNul(nameBytes.get());
        if (!TextHeuristics.isPlausiblePlayerName(name)) {
            return Optional.empty();
        }

        return Optional.of(new PlayerRecord(
                slot,
                slot,
                ReplayText.decodePermissive(name),
                Race.fromCode(raceCode.getAsInt()),
                team.getAsInt(),
                color.getAsInt(),
                kind));
    }
}
