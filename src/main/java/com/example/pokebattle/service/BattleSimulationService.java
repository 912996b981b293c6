package com.example.pokebattle.service;

import com.example.pokebattle.combat.BattleEngine;
import com.example.pokebattle.combat.BattleResult;
import com.example.pokebattle.config.BattleConfig;
import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.error.NotFoundException;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.persistence.PokemonDataSource;
import com.example.pokebattle.util.RandomSource;
import com.example.pokebattle.util.SeededRandomSource;
import com.example.pokebattle.util.ThreadLocalRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Looks up both Pokemon and runs one battle between them. Every call gets its own
 * random source from the supplier, so concurrent calls never share battle state.
 */
public class BattleSimulationService {

    private static final Logger logger = LoggerFactory.getLogger(BattleSimulationService.class);

    private final PokemonDataSource dataSource;
    private final BattleEngine engine;
    private final Supplier<RandomSource> randomSupplier;
    private final boolean allowMirrorMatch;

    public BattleSimulationService(PokemonDataSource dataSource, BattleEngine engine,
                                   Supplier<RandomSource> randomSupplier, boolean allowMirrorMatch) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.randomSupplier = Objects.requireNonNull(randomSupplier, "randomSupplier");
        this.allowMirrorMatch = allowMirrorMatch;
    }

    /**
     * Wire a service from configuration. A configured seed gives every simulation a
     * fresh source with that seed, so repeated requests replay the same battle.
     */
    public static BattleSimulationService fromConfig(BattleConfig config, PokemonDataSource dataSource) {
        Supplier<RandomSource> supplier;
        if (config.hasSeed()) {
            long seed = config.getSeed();
            supplier = () -> new SeededRandomSource(seed);
        } else {
            supplier = () -> ThreadLocalRandomSource.INSTANCE;
        }
        return new BattleSimulationService(dataSource, new BattleEngine(config.getMaxTurns()), supplier,
            config.isAllowMirrorMatch());
    }

    /**
     * @throws InvalidArgumentException for a blank name, or the same name twice when mirror matches are off
     * @throws NotFoundException if either Pokemon is unknown
     */
    public BattleResult simulateBattle(String pokemon1Name, String pokemon2Name, boolean detailed) {
        if (pokemon1Name == null || pokemon1Name.isBlank() || pokemon2Name == null || pokemon2Name.isBlank()) {
            throw new InvalidArgumentException("Both Pokemon names are required");
        }
        String name1 = pokemon1Name.trim();
        String name2 = pokemon2Name.trim();
        if (!allowMirrorMatch && name1.equalsIgnoreCase(name2)) {
            throw new InvalidArgumentException("Mirror matches are disabled: " + name1 + " vs " + name2);
        }

        PokemonBaseProfile profile1 = dataSource.lookupProfile(name1)
            .orElseThrow(() -> NotFoundException.pokemon(name1));
        PokemonBaseProfile profile2 = dataSource.lookupProfile(name2)
            .orElseThrow(() -> NotFoundException.pokemon(name2));

        logger.debug("[BattleSimulationService] Simulating {} vs {} (detailed={})",
            profile1.getName(), profile2.getName(), detailed);
        return engine.simulate(profile1, profile2, randomSupplier.get(), detailed);
    }
}
