/*
 * This file is part of Kreward
 * Copyright (C) 2023 Kreward contributors.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.kreward.reward;

import co.kreward.core.Coin;
import co.kreward.governance.GovernanceParametersProvider;
import co.kreward.governance.RewardParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static co.kreward.reward.RewardTestUtils.activations;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RewardConfigCacheTest {

    private static final RewardParameters PARAMETERS = new RewardParameters(
            Coin.valueOf(1000), "50/25/25", "80/20", 100, true, Coin.valueOf(1));

    private GovernanceParametersProvider provider;

    @BeforeEach
    void setUp() {
        provider = mock(GovernanceParametersProvider.class);
        when(provider.getParametersAt(anyLong())).thenReturn(PARAMETERS);
    }

    @Test
    void parsesOncePerBlock() {
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, true), 4);

        RewardConfig first = cache.get(10);
        RewardConfig second = cache.get(10);

        Assertions.assertSame(first, second);
        Assertions.assertEquals(80, first.getKip82Ratio().getWeight(0));
        verify(provider, times(1)).getParametersAt(10);
    }

    @Test
    void proposerStakersRatioIsOnlyParsedAfterKore() {
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, false), 4);

        RewardConfig config = cache.get(10);

        Assertions.assertEquals(3, config.getRatio().size());
        Assertions.assertThrows(IllegalStateException.class, config::getKip82Ratio);
    }

    @Test
    void evictsLeastRecentlyUsed() {
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, false), 2);

        cache.get(1);
        cache.get(2);
        cache.get(1);
        cache.get(3);
        cache.get(1);
        cache.get(2);

        Assertions.assertEquals(2, cache.size());
        verify(provider, times(1)).getParametersAt(1);
        verify(provider, times(2)).getParametersAt(2);
        verify(provider, times(1)).getParametersAt(3);
    }

    @Test
    void parseFailuresAreNotCached() {
        when(provider.getParametersAt(anyLong())).thenReturn(new RewardParameters(
                Coin.valueOf(1000), "50/25", "80/20", 100, true, Coin.valueOf(1)));
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, false), 4);

        Assertions.assertThrows(MalformedRatioException.class, () -> cache.get(7));
        Assertions.assertThrows(MalformedRatioException.class, () -> cache.get(7));

        Assertions.assertEquals(0, cache.size());
        verify(provider, times(2)).getParametersAt(7);
    }

    @Test
    void providerFailureIsWrapped() {
        IllegalStateException failure = new IllegalStateException("boom");
        when(provider.getParametersAt(anyLong())).thenThrow(failure);
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, false), 4);

        CollaboratorFailureException e = Assertions.assertThrows(CollaboratorFailureException.class,
                () -> cache.get(7));
        Assertions.assertSame(failure, e.getCause());
    }

    @Test
    void missingParametersFail() {
        when(provider.getParametersAt(anyLong())).thenReturn(null);
        RewardConfigCache cache = new RewardConfigCache(provider, activations(false, false), 4);

        Assertions.assertThrows(CollaboratorFailureException.class, () -> cache.getParameters(7));
    }
}
