package org.flip7.base.util.cards;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Random;

import org.flip7.base.util.statemachine.exceptions.EmptyDeckException;

import com.google.common.collect.ImmutableMultiset;

/**
 * An ordered pile of cards, drawn from the front.
 *
 * A deck is owned by exactly one game state.  Anything that wants to explore a hypothetical future takes a
 * {@link #copy()} first.
 */
public class Deck
{
  /**
   * Number of cards in a complete deck.
   */
  public static final int FULL_SIZE = 94;

  private static final ImmutableMultiset<Card> COMPOSITION = ImmutableMultiset.copyOf(enumerate());

  // Cards in draw order.  Everything before mNext has already been drawn.
  private final Card[] mCards;
  private int          mNext;

  /**
   * Create a deck holding the given cards, the first element being the next card to be drawn.
   *
   * @param xiCards - the cards.
   */
  public Deck(Collection<Card> xiCards)
  {
    mCards = xiCards.toArray(new Card[xiCards.size()]);
    mNext = 0;
  }

  private Deck(Card[] xiCards)
  {
    mCards = xiCards;
    mNext = 0;
  }

  /**
   * @return a complete, unshuffled deck in a fixed order: numbers (0, 1, 2, 2, 3, 3, 3 ...), then modifiers
   * (+2 to +10), then FREEZE x2, FLIP_THREE x2, SECOND_CHANCE and the multiplier.
   */
  public static Deck newDeck()
  {
    return new Deck(enumerate());
  }

  /**
   * @return the multiset of cards in a complete deck.
   */
  public static ImmutableMultiset<Card> composition()
  {
    return COMPOSITION;
  }

  /**
   * Shuffle a deck.
   *
   * @param xiDeck - the deck to shuffle.  Not modified.
   * @param xiRandom - source of randomness.  The permutation depends on nothing else.
   *
   * @return a new deck holding the undrawn cards of xiDeck in a random order.
   */
  public static Deck shuffle(Deck xiDeck, Random xiRandom)
  {
    Card[] lCards = Arrays.copyOfRange(xiDeck.mCards, xiDeck.mNext, xiDeck.mCards.length);

    // Fisher-Yates, so that the result is a function of the random stream alone.
    for (int i = lCards.length - 1; i > 0; i--)
    {
      int j = xiRandom.nextInt(i + 1);
      Card lSwap = lCards[i];
      lCards[i] = lCards[j];
      lCards[j] = lSwap;
    }

    return new Deck(lCards);
  }

  /**
   * Remove and return the front card.
   *
   * @return the card.
   * @throws EmptyDeckException if no cards remain.
   */
  public Card draw() throws EmptyDeckException
  {
    if (mNext == mCards.length)
    {
      throw new EmptyDeckException();
    }
    return mCards[mNext++];
  }

  /**
   * @return the front card without drawing it, or null if the deck is empty.
   */
  public Card peek()
  {
    return isEmpty() ? null : mCards[mNext];
  }

  public int size()
  {
    return mCards.length - mNext;
  }

  public boolean isEmpty()
  {
    return mNext == mCards.length;
  }

  /**
   * @return the undrawn cards, front first.
   */
  public List<Card> getCards()
  {
    return new ArrayList<>(Arrays.asList(mCards).subList(mNext, mCards.length));
  }

  /**
   * @return an independent copy of the undrawn cards, in the same order.
   */
  public Deck copy()
  {
    return new Deck(Arrays.copyOfRange(mCards, mNext, mCards.length));
  }

  @Override
  public String toString()
  {
    return "Deck(" + size() + " cards)";
  }

  private static List<Card> enumerate()
  {
    List<Card> lCards = new ArrayList<>(FULL_SIZE);

    // 0 and 1 appear once, every other number n appears n times.
    lCards.add(Card.number(0));
    for (int lValue = 1; lValue <= Card.MAX_NUMBER; lValue++)
    {
      for (int lCopy = 0; lCopy < lValue; lCopy++)
      {
        lCards.add(Card.number(lValue));
      }
    }

    for (int lValue = Card.MIN_MODIFIER; lValue <= Card.MAX_MODIFIER; lValue++)
    {
      lCards.add(Card.modifier(lValue));
    }

    lCards.add(Card.action(ActionType.FREEZE));
    lCards.add(Card.action(ActionType.FREEZE));
    lCards.add(Card.action(ActionType.FLIP_THREE));
    lCards.add(Card.action(ActionType.FLIP_THREE));
    lCards.add(Card.action(ActionType.SECOND_CHANCE));
    lCards.add(Card.multiplier());

    assert(lCards.size() == FULL_SIZE) : "Deck size mismatch: " + lCards.size();
    return lCards;
  }
}
