package org.flip7.base.util.statemachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.flip7.base.util.cards.Card;
import org.flip7.base.util.cards.Deck;

/**
 * Game states dealt from decks in a known order.
 */
public final class StackedDecks
{
  private StackedDecks()
  {
  }

  /**
   * @return a new game whose deck holds exactly the given cards, first card on top.
   */
  public static GameState state(List<String> xiPlayerIds, Card... xiCards)
  {
    return new GameState(xiPlayerIds, new Deck(Arrays.asList(xiCards)));
  }

  /**
   * @return the cards of a line worth 195: the multiplier, every modifier, then 6 to 12 for Flip 7.
   */
  public static List<Card> line195()
  {
    List<Card> lCards = new ArrayList<>();
    lCards.add(Card.multiplier());
    for (int lValue = Card.MIN_MODIFIER; lValue <= Card.MAX_MODIFIER; lValue++)
    {
      lCards.add(Card.modifier(lValue));
    }
    for (int lValue = 6; lValue <= 12; lValue++)
    {
      lCards.add(Card.number(lValue));
    }
    return lCards;
  }

  /**
   * @return a one-player game that has just ended with a total of 200.
   */
  public static GameState finishedGame() throws Exception
  {
    List<Card> lCards = line195();
    lCards.add(Card.number(5));
    lCards.add(Card.number(1));
    GameState lState = new GameState(Arrays.asList("solo"), new Deck(lCards));
    Random lRandom = new Random(0);

    while (lState.getRound() == 1)
    {
      lState.applyAction(Action.HIT, lRandom);
    }
    lState.applyAction(Action.HIT, lRandom);
    lState.applyAction(Action.STAY, lRandom);
    return lState;
  }

  /**
   * @return the cards of a complete deck with one copy of each given number moved to the top, in the order given.
   */
  public static List<Card> fullDeckWithNumbersOnTop(int... xiNumbers)
  {
    List<Card> lRest = Deck.newDeck().getCards();
    List<Card> lCards = new ArrayList<>();
    for (int lValue : xiNumbers)
    {
      lRest.remove(Card.number(lValue));
      lCards.add(Card.number(lValue));
    }
    lCards.addAll(lRest);
    return lCards;
  }
}
