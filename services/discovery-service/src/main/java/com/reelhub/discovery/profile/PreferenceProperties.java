package com.reelhub.discovery.profile;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "discovery.profile")
public class PreferenceProperties {
    private double genreDecay = 0.95;
    private double detailDecay = 0.85;
    private double directorWeight = 3.0;
    private int recentItems = 3;
    private int listItems = 3;
    private int castPerItem = 3;
    private String platformLanguage = "en";

    public double getGenreDecay() {
        return genreDecay;
    }

    public void setGenreDecay(double genreDecay) {
        this.genreDecay = genreDecay;
    }

    public double getDetailDecay() {
        return detailDecay;
    }

    public void setDetailDecay(double detailDecay) {
        this.detailDecay = detailDecay;
    }

    public double getDirectorWeight() {
        return directorWeight;
    }

    public void setDirectorWeight(double directorWeight) {
        this.directorWeight = directorWeight;
    }

    public int getRecentItems() {
        return recentItems;
    }

    public void setRecentItems(int recentItems) {
        this.recentItems = recentItems;
    }

    public int getListItems() {
        return listItems;
    }

    public void setListItems(int listItems) {
        this.listItems = listItems;
    }

    public int getCastPerItem() {
        return castPerItem;
    }

    public void setCastPerItem(int castPerItem) {
        this.castPerItem = castPerItem;
    }

    public String getPlatformLanguage() {
        return platformLanguage;
    }

    public void setPlatformLanguage(String platformLanguage) {
        this.platformLanguage = platformLanguage;
    }
}
