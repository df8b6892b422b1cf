package com.reelhub.discovery.ranking;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "discovery.ranking")
public class RankingProperties {
    private Weights weights = new Weights();
    private Boosts boosts = new Boosts();
    private int homeLimit = 20;
    private int itemLimit = 12;
    private int genreCap = 3;
    private double outlierThreshold = 30.0;
    private String platformLanguage = "en";
    private SavedListPolicy homeSavedListPolicy = SavedListPolicy.PENALTY;
    private SavedListPolicy itemSavedListPolicy = SavedListPolicy.BOOST;

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public Boosts getBoosts() {
        return boosts;
    }

    public void setBoosts(Boosts boosts) {
        this.boosts = boosts;
    }

    public int getHomeLimit() {
        return homeLimit;
    }

    public void setHomeLimit(int homeLimit) {
        this.homeLimit = homeLimit;
    }

    public int getItemLimit() {
        return itemLimit;
    }

    public void setItemLimit(int itemLimit) {
        this.itemLimit = itemLimit;
    }

    public int getGenreCap() {
        return genreCap;
    }

    public void setGenreCap(int genreCap) {
        this.genreCap = genreCap;
    }

    public double getOutlierThreshold() {
        return outlierThreshold;
    }

    public void setOutlierThreshold(double outlierThreshold) {
        this.outlierThreshold = outlierThreshold;
    }

    public String getPlatformLanguage() {
        return platformLanguage;
    }

    public void setPlatformLanguage(String platformLanguage) {
        this.platformLanguage = platformLanguage;
    }

    public SavedListPolicy getHomeSavedListPolicy() {
        return homeSavedListPolicy;
    }

    public void setHomeSavedListPolicy(SavedListPolicy homeSavedListPolicy) {
        this.homeSavedListPolicy = homeSavedListPolicy;
    }

    public SavedListPolicy getItemSavedListPolicy() {
        return itemSavedListPolicy;
    }

    public void setItemSavedListPolicy(SavedListPolicy itemSavedListPolicy) {
        this.itemSavedListPolicy = itemSavedListPolicy;
    }

    /**
     * Score added once per (source, item) match, on top of {@code base}.
     */
    public static class Weights {
        private double franchise = 25.0;
        private double similar = 15.0;
        private double recommendations = 5.0;
        private double myListIntent = 12.0;
        private double director = 12.0;
        private double cast = 8.0;
        private double keyword = 6.0;
        private double language = 5.0;
        private double studio = 5.0;
        private double era = 4.0;
        private double genre = 3.0;
        private double popularGenreMultiplier = 1.5;
        private double base = 2.0;

        public double getFranchise() {
            return franchise;
        }

        public void setFranchise(double franchise) {
            this.franchise = franchise;
        }

        public double getSimilar() {
            return similar;
        }

        public void setSimilar(double similar) {
            this.similar = similar;
        }

        public double getRecommendations() {
            return recommendations;
        }

        public void setRecommendations(double recommendations) {
            this.recommendations = recommendations;
        }

        public double getMyListIntent() {
            return myListIntent;
        }

        public void setMyListIntent(double myListIntent) {
            this.myListIntent = myListIntent;
        }

        public double getDirector() {
            return director;
        }

        public void setDirector(double director) {
            this.director = director;
        }

        public double getCast() {
            return cast;
        }

        public void setCast(double cast) {
            this.cast = cast;
        }

        public double getKeyword() {
            return keyword;
        }

        public void setKeyword(double keyword) {
            this.keyword = keyword;
        }

        public double getLanguage() {
            return language;
        }

        public void setLanguage(double language) {
            this.language = language;
        }

        public double getStudio() {
            return studio;
        }

        public void setStudio(double studio) {
            this.studio = studio;
        }

        public double getEra() {
            return era;
        }

        public void setEra(double era) {
            this.era = era;
        }

        public double getGenre() {
            return genre;
        }

        public void setGenre(double genre) {
            this.genre = genre;
        }

        public double getPopularGenreMultiplier() {
            return popularGenreMultiplier;
        }

        public void setPopularGenreMultiplier(double popularGenreMultiplier) {
            this.popularGenreMultiplier = popularGenreMultiplier;
        }

        public double getBase() {
            return base;
        }

        public void setBase(double base) {
            this.base = base;
        }
    }

    public static class Boosts {
        private double homeGenre = 2.0;
        private double itemGenre = 3.0;
        private double language = 3.0;
        private double era = 3.0;
        private double savedListPenalty = 5.0;
        private double savedListBoost = 10.0;

        public double getHomeGenre() {
            return homeGenre;
        }

        public void setHomeGenre(double homeGenre) {
            this.homeGenre = homeGenre;
        }

        public double getItemGenre() {
            return itemGenre;
        }

        public void setItemGenre(double itemGenre) {
            this.itemGenre = itemGenre;
        }

        public double getLanguage() {
            return language;
        }

        public void setLanguage(double language) {
            this.language = language;
        }

        public double getEra() {
            return era;
        }

        public void setEra(double era) {
            this.era = era;
        }

        public double getSavedListPenalty() {
            return savedListPenalty;
        }

        public void setSavedListPenalty(double savedListPenalty) {
            this.savedListPenalty = savedListPenalty;
        }

        public double getSavedListBoost() {
            return savedListBoost;
        }

        public void setSavedListBoost(double savedListBoost) {
            this.savedListBoost = savedListBoost;
        }
    }
}
